package com.withretries.core;

import java.util.concurrent.CompletableFuture;

/**
 * 无参的可重试调用
 */
@FunctionalInterface
public interface RetryingSupplier<R> {

    CompletableFuture<R> get();
}
