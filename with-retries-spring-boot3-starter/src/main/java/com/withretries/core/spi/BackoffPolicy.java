package com.withretries.core.spi;

/**
 * 回退策略（计算某次尝试失败后的基础等待时长，不含抖动）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"） */
    String name();

    /**
     * @param attemptIndex       刚失败的尝试序号，从0开始
     * @param initialDelayMillis 初始间隔
     * @param maxDelayMillis     最大间隔，不封顶时为 Long.MAX_VALUE
     * @return 基础等待毫秒数，范围 [0, maxDelayMillis]
     */
    long baseDelayMillis(int attemptIndex, long initialDelayMillis, long maxDelayMillis);
}
