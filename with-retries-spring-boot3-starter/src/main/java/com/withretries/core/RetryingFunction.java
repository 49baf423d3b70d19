package com.withretries.core;

import java.util.concurrent.CompletableFuture;

/**
 * 包装后的可重试调用
 * 每次 apply 都是一次独立的调用，拥有自己的尝试计数与定时器
 */
@FunctionalInterface
public interface RetryingFunction<A, R> {

    CompletableFuture<R> apply(A args);
}
