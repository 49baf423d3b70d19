package com.withretries.core.backoff;

import com.withretries.core.spi.BackoffPolicy;

/**
 * 指数退避：initialDelay * 2^attemptIndex，封顶 maxDelay
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    /** 超过该位移量后 long 必然溢出 */
    private static final int MAX_SHIFT = 62;

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long baseDelayMillis(int attemptIndex, long initialDelayMillis, long maxDelayMillis) {
        long max = Math.max(0, maxDelayMillis);
        if (initialDelayMillis <= 0) {
            return 0;
        }
        // attemptIndex从0开始计数：0 -> initial, 1 -> initial * 2 ...
        int shift = Math.min(Math.max(0, attemptIndex), MAX_SHIFT);
        long ideal = initialDelayMillis > (Long.MAX_VALUE >> shift)
                ? Long.MAX_VALUE
                : initialDelayMillis << shift;
        return Math.min(ideal, max);
    }
}
