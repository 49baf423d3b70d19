package com.withretries.core.backoff;

import com.withretries.core.spi.BackoffPolicy;
import com.withretries.model.RetryPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * 延迟计算：尝试序号 -> 等待时长
 * - 按 exponentialBackoff 选择 exponential / fixed 策略得到基础间隔
 * - 开启 jitter 时在 [0, base] 内均匀取值，打散并发调用方的重试时刻
 * - 无状态，线程安全
 */
public class DelayScheduler {

    private final BackoffPolicy exponential;

    private final BackoffPolicy fixed;

    /** 输入上界 bound，返回 [0, bound] 内的值 */
    private final LongUnaryOperator jitterSource;

    public DelayScheduler() {
        this(new ExponentialBackoffPolicy(), new FixedBackoffPolicy(), DelayScheduler::uniform);
    }

    public DelayScheduler(BackoffPolicy exponential, BackoffPolicy fixed, LongUnaryOperator jitterSource) {
        this.exponential = Objects.requireNonNull(exponential, "exponential");
        this.fixed = Objects.requireNonNull(fixed, "fixed");
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource");
    }

    /**
     * @param attemptIndex 刚失败的尝试序号，从0开始
     */
    public Duration computeDelay(int attemptIndex, RetryPolicy<?, ?> policy) {
        long max = policy.maxDelayMillis();
        long base = resolve(policy).baseDelayMillis(attemptIndex, policy.initialDelayMillis(), max);
        base = Math.max(0, Math.min(base, max));
        if (!policy.isJitter() || base == 0) {
            return Duration.ofMillis(base);
        }
        long jittered = jitterSource.applyAsLong(base);
        return Duration.ofMillis(Math.max(0, Math.min(jittered, base)));
    }

    public BackoffPolicy resolve(RetryPolicy<?, ?> policy) {
        return policy.isExponentialBackoff() ? exponential : fixed;
    }

    private static long uniform(long bound) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return bound == Long.MAX_VALUE ? random.nextLong(bound) : random.nextLong(bound + 1);
    }
}
