package com.withretries.core.engine;

import com.withretries.config.RetryCallProperties;
import com.withretries.core.RetryingFunction;
import com.withretries.core.RetryingSupplier;
import com.withretries.core.backoff.DelayScheduler;
import com.withretries.core.metric.RetryMetrics;
import com.withretries.core.notify.RetryEventPublisher;
import com.withretries.core.spi.AsyncScopedOperation;
import com.withretries.core.spi.ScopedOperation;
import com.withretries.model.RetryPolicy;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 重试执行器
 *
 * 将任意操作包装为可重试的异步调用:
 * - 策略在包装时确定, 之后只读, 可被并发调用共享
 * - 每次调用拥有独立的 {@link AttemptLoop}
 * - 等待由时间轮承担, 操作在执行线程池中运行
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    /** 时间轮 */
    private final HashedWheelTimer timer;

    /** 尝试执行线程池 */
    private final ExecutorService attemptExecutor;

    private final DelayScheduler scheduler;

    /** 指标 */
    private final RetryMetrics meter;

    /** 事件派发 */
    private final RetryEventPublisher publisher;

    /** 配置 */
    private final RetryCallProperties props;

    /** 运行状态, 停机后拒绝新调用 */
    private final AtomicBoolean running = new AtomicBoolean(true);

    private final AtomicLong callIds = new AtomicLong();

    /** 未结束的调用 */
    private final Set<AttemptLoop<?, ?, ?>> active = ConcurrentHashMap.newKeySet();

    public RetryExecutor(HashedWheelTimer timer,
                         ExecutorService attemptExecutor,
                         DelayScheduler scheduler,
                         RetryMetrics meter,
                         RetryEventPublisher publisher,
                         RetryCallProperties props) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.attemptExecutor = Objects.requireNonNull(attemptExecutor, "attemptExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.meter = Objects.requireNonNull(meter, "meter");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * 包装同步操作
     */
    public <S, A, R> RetryingFunction<A, R> wrap(ScopedOperation<S, A, R> op, RetryPolicy<S, R> policy) {
        Objects.requireNonNull(op, "op");
        AsyncScopedOperation<S, A, R> async = (scope, args) -> CompletableFuture.completedFuture(op.call(scope, args));
        return wrapAsync(async, policy);
    }

    /**
     * 使用默认策略包装同步操作
     */
    public <S, A, R> RetryingFunction<A, R> wrap(ScopedOperation<S, A, R> op) {
        return wrap(op, this.<S, R>policyBuilder().build());
    }

    /**
     * 包装异步操作
     */
    public <S, A, R> RetryingFunction<A, R> wrapAsync(AsyncScopedOperation<S, A, R> op, RetryPolicy<S, R> policy) {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(policy, "policy");
        return args -> start(op, args, policy);
    }

    public <S, A, R> RetryingFunction<A, R> wrapAsync(AsyncScopedOperation<S, A, R> op) {
        return wrapAsync(op, this.<S, R>policyBuilder().build());
    }

    /**
     * 包装无参操作, 策略中的 callScope 不会被使用
     */
    public <R> RetryingSupplier<R> wrapCallable(Callable<R> op, RetryPolicy<?, R> policy) {
        Objects.requireNonNull(op, "op");
        RetryingFunction<Void, R> fn = bindCallable(op, policy);
        return () -> fn.apply(null);
    }

    public <R> RetryingSupplier<R> wrapCallable(Callable<R> op) {
        return wrapCallable(op, this.<Object, R>policyBuilder().build());
    }

    /**
     * 以配置的默认值预填的策略构造器
     */
    public <S, R> RetryPolicy.RetryPolicyBuilder<S, R> policyBuilder() {
        RetryCallProperties.Defaults d = props.getDefaults();
        return RetryPolicy.<S, R>builder()
                .profile(d.getProfile())
                .maxAttempts(d.getMaxAttempts())
                .initialDelay(d.getInitialDelay())
                .maxDelay(d.getMaxDelay())
                .exponentialBackoff(d.isExponentialBackoff())
                .jitter(d.isJitter());
    }

    private <S, R> RetryingFunction<Void, R> bindCallable(Callable<R> op, RetryPolicy<S, R> policy) {
        return wrap((ScopedOperation<S, Void, R>) (scope, ignored) -> op.call(), policy);
    }

    private <S, A, R> CompletableFuture<R> start(AsyncScopedOperation<S, A, R> op, A args, RetryPolicy<S, R> policy) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("retry executor is shut down"));
        }
        AttemptLoop<S, A, R> loop = new AttemptLoop<>(callIds.incrementAndGet(), op, args, policy, this);
        active.add(loop);
        loop.result().whenComplete((v, e) -> active.remove(loop));
        meter.incStarted();
        loop.start();
        return loop.result();
    }

    /**
     * 停止接受新调用, 结束时间轮上等待中的调用, 等待在途尝试完成
     */
    public void gracefulShutdown(Duration await) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        // 时间轮上尚未到期的调用直接结束
        Set<Timeout> unprocessed = timer.stop();
        for (Timeout t : unprocessed) {
            if (t.task() instanceof AttemptTimerTask task) {
                task.getLoop().abort("retry executor stopped while waiting");
            }
        }
        log.info("[Retry-Executor] timer stopped, {} waiting calls cancelled, {} calls in flight",
                unprocessed.size(), active.size());

        attemptExecutor.shutdown();
        try {
            if (!attemptExecutor.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Retry-Executor] attempts still running after {} ms, interrupting", await.toMillis());
                attemptExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            attemptExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            for (AttemptLoop<?, ?, ?> loop : active) {
                loop.abort("retry executor stopped");
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** 未结束的调用数 */
    public int activeCalls() {
        return active.size();
    }

    public RetryCallProperties getProps() {
        return props;
    }

    HashedWheelTimer timer() {
        return timer;
    }

    ExecutorService attemptExecutor() {
        return attemptExecutor;
    }

    DelayScheduler scheduler() {
        return scheduler;
    }

    RetryMetrics meter() {
        return meter;
    }

    RetryEventPublisher publisher() {
        return publisher;
    }
}
