package com.withretries.autoconfig;

import com.withretries.config.RetryCallProperties;
import com.withretries.core.RetryExecutorLifecycle;
import com.withretries.core.backoff.DelayScheduler;
import com.withretries.core.engine.RetryExecutor;
import com.withretries.core.metric.RetryMetrics;
import com.withretries.core.notify.LoggingRetryListener;
import com.withretries.core.notify.RetryEventPublisher;
import com.withretries.core.spi.RetryListener;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 时间轮、尝试线程池及重试执行器
 */
@AutoConfiguration(after = RetryCallMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RetryCallProperties.class)
public class RetryCallAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public HashedWheelTimer retryWheelTimer(RetryCallProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("retry-wheel-timer"),
                props.wheelTickMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 尝试执行线程池
     * 固定 AbortPolicy, 派发被拒绝时调用立即失败
     */
    @Bean(name = "retryAttemptExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "retryAttemptExecutor")
    public ExecutorService retryAttemptExecutor(RetryCallProperties props) {
        RetryCallProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                Math.max(exec.getCorePoolSize(), exec.getMaxPoolSize()),
                props.executorKeepAliveSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(exec.getQueueCapacity()),
                new NamedThreadFactory("retry-attempt-exec"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public DelayScheduler delayScheduler() {
        return new DelayScheduler();
    }

    /**
     * 默认日志监听
     */
    @Bean
    @ConditionalOnProperty(prefix = "retry", name = "log-events", havingValue = "true", matchIfMissing = true)
    public LoggingRetryListener loggingRetryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryEventPublisher retryEventPublisher(ObjectProvider<RetryListener> listeners) {
        return new RetryEventPublisher(listeners.orderedStream().collect(Collectors.toList()));
    }

    /**
     * 重试执行器
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(HashedWheelTimer timer,
                                       @Qualifier("retryAttemptExecutor") ExecutorService attemptExecutor,
                                       DelayScheduler scheduler,
                                       ObjectProvider<RetryMetrics> meter,
                                       RetryEventPublisher publisher,
                                       RetryCallProperties props) {
        return new RetryExecutor(timer, attemptExecutor, scheduler,
                meter.getIfAvailable(RetryMetrics::noop), publisher, props);
    }

    /**
     * 停机时结束等待中的调用
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryExecutorLifecycle retryExecutorLifecycle(RetryExecutor executor, RetryCallProperties props) {
        return new RetryExecutorLifecycle(executor, props);
    }
}
