package com.withretries.core.backoff;

import com.withretries.core.spi.BackoffPolicy;

/**
 * 固定间隔策略
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public long baseDelayMillis(int attemptIndex, long initialDelayMillis, long maxDelayMillis) {
        return Math.min(Math.max(0, initialDelayMillis), Math.max(0, maxDelayMillis));
    }
}
