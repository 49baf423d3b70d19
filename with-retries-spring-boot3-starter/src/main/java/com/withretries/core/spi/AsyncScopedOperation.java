package com.withretries.core.spi;

import java.util.concurrent.CompletionStage;

/**
 * 异步操作：同步抛出异常与返回失败的 stage 都视为本次尝试失败
 */
@FunctionalInterface
public interface AsyncScopedOperation<S, A, R> {

    CompletionStage<R> call(S scope, A args) throws Exception;
}
