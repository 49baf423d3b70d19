package com.withretries.core.engine;

import com.withretries.core.spi.AsyncScopedOperation;
import com.withretries.core.spi.ExhaustionHandler;
import com.withretries.exception.RetryConditionFailedException;
import com.withretries.model.RetryPolicy;
import com.withretries.model.ctx.RetryEvent;
import com.withretries.model.enums.RetryEventType;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * 单次调用的尝试循环
 *
 * INVOKING -> (SUCCESS | FAILURE) -> (DONE | WAITING -> INVOKING)
 * - 每次尝试都作为新任务提交到执行线程池, 时间轮只负责唤醒, 栈深度与尝试次数无关
 * - 同一时刻最多一个尝试在途, attempt 只由在途尝试推进
 * - 调用方取消 result 时, 同时取消挂起的 Timeout 与在途任务
 * - 终态的指标与事件先于 result 完成记录, 由 finished 保证只记录一次
 * - 线程池任务、stage 回调与时间轮回调中逃逸的异常都会结束 result
 */
final class AttemptLoop<S, A, R> {

    private static final Logger log = LoggerFactory.getLogger(AttemptLoop.class);

    enum State { INVOKING, WAITING, DONE }

    private final long callId;

    private final AsyncScopedOperation<S, A, R> op;

    private final A args;

    private final RetryPolicy<S, R> policy;

    private final RetryExecutor engine;

    private final CompletableFuture<R> result = new CompletableFuture<>();

    private final AtomicBoolean finished = new AtomicBoolean(false);

    private volatile State state = State.INVOKING;

    private volatile int attempt;

    /** WAITING 阶段的定时器 */
    private volatile Timeout pendingTimeout;

    /** 已提交到线程池的尝试任务 */
    private volatile Future<?> pendingTask;

    /** 异步操作返回的在途 stage（仅当其实现了 Future 时可取消） */
    private volatile Future<?> inFlight;

    AttemptLoop(long callId, AsyncScopedOperation<S, A, R> op, A args,
                RetryPolicy<S, R> policy, RetryExecutor engine) {
        this.callId = callId;
        this.op = op;
        this.args = args;
        this.policy = policy;
        this.engine = engine;
    }

    CompletableFuture<R> result() {
        return result;
    }

    void start() {
        result.whenComplete((v, e) -> {
            state = State.DONE;
            if (result.isCancelled()) {
                onCancelled();
            }
        });
        dispatch();
    }

    /**
     * 时间轮到期回调, 运行在时间轮线程, 只做派发
     */
    void resume() {
        pendingTimeout = null;
        try {
            dispatch();
        } catch (Throwable t) {
            crash(t);
        }
    }

    /**
     * 以 CancellationException 结束调用（停机时使用）
     */
    void abort(String reason) {
        result.completeExceptionally(new CancellationException(reason));
    }

    private void dispatch() {
        if (result.isDone()) {
            return;
        }
        try {
            pendingTask = engine.attemptExecutor().submit(this::invoke);
        } catch (RejectedExecutionException e) {
            log.warn("[Attempt-Loop] call={} attempt={} state={} rejected by executor: {}",
                    callId, attempt, state, e.toString());
            result.completeExceptionally(e);
            return;
        }
        if (result.isCancelled()) {
            cancelPending();
        }
    }

    private void invoke() {
        try {
            runAttempt();
        } catch (Throwable t) {
            crash(t);
        }
    }

    private void runAttempt() {
        if (result.isDone()) {
            return;
        }
        state = State.INVOKING;
        final int current = attempt;
        engine.meter().incAttempt();

        CompletionStage<R> stage;
        try {
            stage = op.call(policy.getCallScope(), args);
        } catch (Throwable t) {
            onFailure(current, t);
            return;
        }
        if (stage == null) {
            onFailure(current, new NullPointerException("operation returned a null CompletionStage"));
            return;
        }

        inFlight = stage instanceof Future<?> f ? f : null;
        stage.whenComplete((value, err) -> {
            inFlight = null;
            try {
                if (err != null) {
                    onFailure(current, unwrap(err));
                } else {
                    onSuccess(current, value);
                }
            } catch (Throwable t) {
                crash(t);
            }
        });
        if (result.isCancelled()) {
            cancelPending();
        }
    }

    private void onSuccess(int current, R value) {
        if (result.isDone()) {
            return;
        }
        Predicate<? super R> retryWhen = policy.getRetryWhen();
        if (retryWhen != null) {
            boolean again;
            try {
                again = retryWhen.test(value);
            } catch (Throwable t) {
                onFailure(current, t);
                return;
            }
            if (again) {
                onFailure(current, new RetryConditionFailedException(value, current));
                return;
            }
        }
        if (finished.compareAndSet(false, true)) {
            engine.meter().incSucceeded();
            engine.meter().recordAttempts(current + 1);
            fire(RetryEventType.SUCCEEDED, current, value, null, null);
            result.complete(value);
        }
    }

    private void onFailure(int current, Throwable err) {
        if (result.isDone()) {
            return;
        }
        if (current >= policy.getMaxAttempts() - 1) {
            exhaust(current, err);
            return;
        }
        if (!engine.isRunning()) {
            abort("retry executor is shutting down");
            return;
        }

        Duration delay = engine.scheduler().computeDelay(current, policy);
        attempt = current + 1;
        state = State.WAITING;
        engine.meter().incRetry();
        engine.meter().recordWaitMillis(delay.toMillis());
        fire(RetryEventType.RETRY_SCHEDULED, current, null, err, delay);
        log.debug("[Attempt-Loop] call={} attempt={}/{} failed, next in {}ms: {}",
                callId, current + 1, policy.getMaxAttempts(), delay.toMillis(), err.toString());

        if (delay.isZero()) {
            dispatch();
        } else {
            schedule(delay, err);
        }
    }

    private void schedule(Duration delay, Throwable lastError) {
        try {
            pendingTimeout = engine.timer().newTimeout(new AttemptTimerTask(this),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或挂起数量超限
            log.warn("[Attempt-Loop] call={} cannot schedule retry: {}", callId, e.toString());
            e.addSuppressed(lastError);
            result.completeExceptionally(e);
            return;
        }
        if (result.isCancelled()) {
            cancelPending();
        }
    }

    private void exhaust(int current, Throwable err) {
        ExhaustionHandler<? extends R> handler = policy.getOnExhausted();
        if (handler == null) {
            failTerminally(current, err);
            return;
        }

        R recovered;
        try {
            recovered = handler.onExhausted(err);
        } catch (Throwable delegateErr) {
            failTerminally(current, delegateErr);
            return;
        }
        if (finished.compareAndSet(false, true)) {
            engine.meter().incRecovered();
            engine.meter().recordAttempts(current + 1);
            fire(RetryEventType.RECOVERED, current, recovered, err, null);
            result.complete(recovered);
        }
    }

    private void failTerminally(int current, Throwable err) {
        if (finished.compareAndSet(false, true)) {
            engine.meter().incExhausted();
            engine.meter().recordAttempts(current + 1);
            fire(RetryEventType.EXHAUSTED, current, null, err, null);
            result.completeExceptionally(err);
        }
    }

    /**
     * 循环自身出错（延迟计算、监听器 Error 等）, 不再触发事件, 直接结束调用
     */
    private void crash(Throwable t) {
        log.error("[Attempt-Loop] call={} attempt={} state={} aborted by unexpected error",
                callId, attempt, state, t);
        if (finished.compareAndSet(false, true)) {
            engine.meter().incExhausted();
            engine.meter().recordAttempts(attempt + 1);
        }
        result.completeExceptionally(t);
    }

    private void onCancelled() {
        cancelPending();
        if (finished.compareAndSet(false, true)) {
            engine.meter().incCancelled();
            fire(RetryEventType.CANCELLED, attempt, null, null, null);
        }
    }

    private void cancelPending() {
        Timeout t = pendingTimeout;
        if (t != null) {
            t.cancel();
        }
        Future<?> task = pendingTask;
        if (task != null) {
            task.cancel(true);
        }
        Future<?> stage = inFlight;
        if (stage != null) {
            stage.cancel(true);
        }
    }

    private void fire(RetryEventType type, int current, Object value, Throwable err, Duration delay) {
        engine.publisher().fire(RetryEvent.builder()
                .type(type)
                .callId(callId)
                .attempt(current)
                .maxAttempts(policy.getMaxAttempts())
                .result(value)
                .error(err)
                .delay(delay)
                .build());
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
