package com.withretries.core.spi;

import com.withretries.model.ctx.RetryEvent;

/**
 * 重试事件监听器
 */
public interface RetryListener {

    /**
     * 返回此监听器名称, 用于日志
     */
    String name();

    /**
     * 能否处理此事件, 粗粒度过滤
     */
    default boolean supports(RetryEvent event) {
        return true;
    }

    /**
     * 同步回调, 在尝试所在线程执行, 不应阻塞
     */
    void onEvent(RetryEvent event);
}
