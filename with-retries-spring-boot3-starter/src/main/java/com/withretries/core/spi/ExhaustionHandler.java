package com.withretries.core.spi;

/**
 * 尝试次数耗尽后的错误委托
 * 正常返回则调用以该返回值成功结束；抛出异常则以该异常替换原始错误
 */
@FunctionalInterface
public interface ExhaustionHandler<R> {

    R onExhausted(Throwable lastError) throws Exception;
}
