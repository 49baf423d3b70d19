package com.withretries.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class RetryMetrics {
    private final Counter started;
    private final Counter attempts;
    private final Counter retries;
    private final Counter succeeded;
    private final Counter exhausted;
    private final Counter recovered;
    private final Counter cancelled;
    private final DistributionSummary attemptsPerCall;
    private final Timer waitTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.started   = Counter.builder("retry.call.started").description("calls started").register(reg);
        this.attempts  = Counter.builder("retry.attempt").description("operation invocations").register(reg);
        this.retries   = Counter.builder("retry.retry.scheduled").description("retries scheduled").register(reg);
        this.succeeded = Counter.builder("retry.call.succeeded").description("calls succeeded").register(reg);
        this.exhausted = Counter.builder("retry.call.exhausted").description("calls failed after last attempt").register(reg);
        this.recovered = Counter.builder("retry.call.recovered").description("calls recovered by onExhausted").register(reg);
        this.cancelled = Counter.builder("retry.call.cancelled").description("calls cancelled").register(reg);
        this.attemptsPerCall = DistributionSummary.builder("retry.call.attempts")
                .description("attempt count per finished call").baseUnit("times").register(reg);
        this.waitTimer = Timer.builder("retry.wait.time").description("scheduled wait before retry").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /** 未接入任何注册表时使用 */
    public static RetryMetrics noop() { return new RetryMetrics(new SimpleMeterRegistry()); }

    public void incStarted(){   started.increment(); }
    public void incAttempt(){   attempts.increment(); }
    public void incRetry(){     retries.increment(); }
    public void incSucceeded(){ succeeded.increment(); }
    public void incExhausted(){ exhausted.increment(); }
    public void incRecovered(){ recovered.increment(); }
    public void incCancelled(){ cancelled.increment(); }
    public void recordAttempts(int n){ attemptsPerCall.record(n); }
    public void recordWaitMillis(long millis){ waitTimer.record(millis, TimeUnit.MILLISECONDS); }
}
