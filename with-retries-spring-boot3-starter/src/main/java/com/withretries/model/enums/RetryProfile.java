package com.withretries.model.enums;

import java.time.Duration;

/**
 * 预置的默认值组合
 */
public enum RetryProfile {

    /** 3 次尝试，首次间隔 500ms */
    STANDARD(3, Duration.ofMillis(500)),

    /** 5 次尝试，首次间隔 100ms，适合短抖动的下游 */
    PERSISTENT(5, Duration.ofMillis(100));

    private final int maxAttempts;

    private final Duration initialDelay;

    RetryProfile(int maxAttempts, Duration initialDelay) {
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }
}
