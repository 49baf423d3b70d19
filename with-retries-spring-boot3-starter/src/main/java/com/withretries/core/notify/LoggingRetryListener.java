package com.withretries.core.notify;

import com.withretries.core.spi.RetryListener;
import com.withretries.model.ctx.RetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志监听, 默认启用
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onEvent(RetryEvent e) {
        switch (e.getType()) {
            case EXHAUSTED -> log.error("[Retry-{}] call={}, attempts={}/{}, err={}",
                    e.getType(), e.getCallId(), e.getAttempt() + 1, e.getMaxAttempts(), truncate(e.getError()));
            case RETRY_SCHEDULED -> log.warn("[Retry-{}] call={}, attempt={}/{}, delay={}ms, err={}",
                    e.getType(), e.getCallId(), e.getAttempt() + 1, e.getMaxAttempts(),
                    e.getDelay() == null ? 0 : e.getDelay().toMillis(), truncate(e.getError()));
            case RECOVERED, CANCELLED -> log.info("[Retry-{}] call={}, attempt={}/{}",
                    e.getType(), e.getCallId(), e.getAttempt() + 1, e.getMaxAttempts());
            default -> log.debug("[Retry-{}] call={}, attempt={}", e.getType(), e.getCallId(), e.getAttempt() + 1);
        }
    }

    private String truncate(Throwable t) {
        if (t == null) {
            return null;
        }
        String s = t.toString();
        return s.length() > 2000 ? s.substring(0, 2000) : s;
    }
}
