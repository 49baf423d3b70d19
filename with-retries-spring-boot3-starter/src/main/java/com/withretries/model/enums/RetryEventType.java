package com.withretries.model.enums;

/**
 * 重试事件
 */
public enum RetryEventType {
    /** 本次尝试失败，已安排下一次 */
    RETRY_SCHEDULED,

    /** 调用成功 */
    SUCCEEDED,

    /** 尝试次数耗尽，调用以失败结束 */
    EXHAUSTED,

    /** 尝试次数耗尽，onExhausted 正常返回 */
    RECOVERED,

    /** 调用方取消或执行器停机 */
    CANCELLED
}
