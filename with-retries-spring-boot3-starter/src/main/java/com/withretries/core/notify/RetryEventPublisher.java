package com.withretries.core.notify;

import com.withretries.core.spi.RetryListener;
import com.withretries.model.ctx.RetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 将事件派发给所有监听器
 * 监听器异常只记录日志，不影响调用结果
 */
public class RetryEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RetryEventPublisher.class);

    private final List<RetryListener> listeners;

    public RetryEventPublisher(List<RetryListener> listeners) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public void fire(RetryEvent event) {
        for (RetryListener l : listeners) {
            try {
                if (l.supports(event)) {
                    l.onEvent(event);
                }
            } catch (Exception e) {
                log.warn("[Retry-Event] listener {} failed on {} of call {}: {}",
                        l.name(), event.getType(), event.getCallId(), e.toString());
            }
        }
    }
}
