package com.withretries.core;

import com.withretries.config.RetryCallProperties;
import com.withretries.core.engine.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class RetryExecutorLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutorLifecycle.class);

    private final RetryExecutor executor;

    private final RetryCallProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RetryExecutorLifecycle(RetryExecutor executor, RetryCallProperties props) {
        this.executor = executor;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        RetryCallProperties.Defaults d = props.getDefaults();
        log.info("[Retry-Executor] started: wheel.tick={}ms, wheel.size={}, exec.core={}, exec.max={}, exec.queue={}",
                props.wheelTickMillis(), props.getWheel().getTicksPerWheel(),
                props.getExecutor().getCorePoolSize(), props.getExecutor().getMaxPoolSize(),
                props.getExecutor().getQueueCapacity());
        log.info("[Retry-Executor] defaults: profile={}, maxAttempts={}, initialDelay={}, maxDelay={}, exponential={}, jitter={}",
                d.getProfile(), d.getMaxAttempts(), d.getInitialDelay(), d.getMaxDelay(),
                d.isExponentialBackoff(), d.isJitter());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Retry-Executor] stop skipped: already stopped");
            return;
        }
        log.info("[Retry-Executor] stopping, {} calls active", executor.activeCalls());
        try {
            executor.gracefulShutdown(props.getShutdown().getAwait());
        } finally {
            log.info("[Retry-Executor] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
