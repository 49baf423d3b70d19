package com.withretries.core.spi;

/**
 * 同步操作：直接返回结果或抛出异常
 *
 * @param <S> 作用域（接收者）类型，未配置 callScope 时为 null
 * @param <A> 参数类型，多个参数可用 record 组合
 * @param <R> 结果类型
 */
@FunctionalInterface
public interface ScopedOperation<S, A, R> {

    R call(S scope, A args) throws Exception;
}
