package com.withretries.model.ctx;

import com.withretries.model.enums.RetryEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 单次尝试的结果快照
 */
@Getter
@Builder
@ToString
public class RetryEvent {

    private final RetryEventType type;

    /** 调用id, 同一次调用的所有尝试共享 */
    private final long callId;

    /** 尝试序号, 从0开始 */
    private final int attempt;

    private final int maxAttempts;

    /** 成功结果或 onExhausted 的返回值 */
    private final Object result;

    private final Throwable error;

    /** 下一次尝试前的等待, 仅 RETRY_SCHEDULED 有值 */
    private final Duration delay;
}
