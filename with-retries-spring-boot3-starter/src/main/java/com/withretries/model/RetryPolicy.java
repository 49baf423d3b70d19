package com.withretries.model;

import com.withretries.core.spi.ExhaustionHandler;
import com.withretries.model.enums.RetryProfile;
import lombok.Builder;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 不可变的重试策略，构造一次后可被任意多个（包括并发的）调用共享
 *
 * 未设置的项按 profile 取默认值：
 * - maxAttempts / initialDelay 来自 {@link RetryProfile}
 * - maxDelay 为 null 表示不封顶
 * - exponentialBackoff / jitter 默认开启
 *
 * @param <S> 调用作用域（接收者）类型
 * @param <R> 操作结果类型
 */
@Getter
public final class RetryPolicy<S, R> {

    private final RetryProfile profile;

    /** 每次调用最多执行操作的次数（含首次） */
    private final int maxAttempts;

    private final Duration initialDelay;

    @Nullable
    private final Duration maxDelay;

    private final boolean exponentialBackoff;

    private final boolean jitter;

    /** 对成功结果的判定，返回 true 表示该结果仍需重试 */
    @Nullable
    private final Predicate<? super R> retryWhen;

    /** 耗尽时的错误委托，未设置则直接失败 */
    @Nullable
    private final ExhaustionHandler<? extends R> onExhausted;

    /** 每次尝试传给操作的作用域，未设置时操作收到 null */
    @Nullable
    private final S callScope;

    @Builder
    private RetryPolicy(RetryProfile profile,
                        Integer maxAttempts,
                        Duration initialDelay,
                        Duration maxDelay,
                        Boolean exponentialBackoff,
                        Boolean jitter,
                        Predicate<? super R> retryWhen,
                        ExhaustionHandler<? extends R> onExhausted,
                        S callScope) {
        this.profile = profile == null ? RetryProfile.STANDARD : profile;
        this.maxAttempts = maxAttempts == null ? this.profile.getMaxAttempts() : maxAttempts;
        this.initialDelay = initialDelay == null ? this.profile.getInitialDelay() : initialDelay;
        this.maxDelay = maxDelay;
        this.exponentialBackoff = exponentialBackoff == null || exponentialBackoff;
        this.jitter = jitter == null || jitter;
        this.retryWhen = retryWhen;
        this.onExhausted = onExhausted;
        this.callScope = callScope;

        if (this.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + this.maxAttempts);
        }
        if (this.initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (this.maxDelay != null && this.maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative");
        }
    }

    /** 全部取默认值的策略 */
    public static <S, R> RetryPolicy<S, R> defaults() {
        return RetryPolicy.<S, R>builder().build();
    }

    /** 超出 long 毫秒范围时取 Long.MAX_VALUE */
    public long initialDelayMillis() {
        return saturatedMillis(initialDelay);
    }

    /** 未封顶或超出 long 毫秒范围时返回 Long.MAX_VALUE */
    public long maxDelayMillis() {
        return maxDelay == null ? Long.MAX_VALUE : saturatedMillis(maxDelay);
    }

    private static long saturatedMillis(Duration d) {
        if (d.getSeconds() >= Long.MAX_VALUE / 1000) {
            return Long.MAX_VALUE;
        }
        return d.toMillis();
    }

    @Override
    public String toString() {
        return "RetryPolicy{profile=" + profile
                + ", maxAttempts=" + maxAttempts
                + ", initialDelay=" + initialDelay
                + ", maxDelay=" + (maxDelay == null ? "unbounded" : maxDelay)
                + ", exponentialBackoff=" + exponentialBackoff
                + ", jitter=" + jitter
                + ", retryWhen=" + (retryWhen != null)
                + ", onExhausted=" + (onExhausted != null)
                + ", callScope=" + (callScope != null) + '}';
    }
}
