package com.connretry.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class RetryMetrics {
    private final Counter calls;
    private final Counter success;
    private final Counter attemptFailed;
    private final Counter exhausted;
    private final Counter rejected;
    private final Counter reconnect;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.calls     = Counter.builder("retry.connector.calls").description("outer calls").register(reg);
        this.success   = Counter.builder("retry.connector.success").description("calls succeeded").register(reg);
        this.attemptFailed = Counter.builder("retry.connector.attempt.failed").description("failed attempts").register(reg);
        this.exhausted = Counter.builder("retry.connector.exhausted").description("calls failed at max attempts").register(reg);
        this.rejected  = Counter.builder("retry.connector.rejected").description("calls failed by retry predicate").register(reg);
        this.reconnect = Counter.builder("retry.connector.reconnect").description("handle replaced by mode controller").register(reg);
        this.attempts  = DistributionSummary.builder("retry.connector.attempts")
                .description("failed attempts before success").baseUnit("times").register(reg);
        this.execTimer = Timer.builder("retry.connector.exec.time").description("outer call execution time").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /** 非 Spring 环境下使用的独立注册表 */
    public static RetryMetrics standalone() { return new RetryMetrics(new SimpleMeterRegistry()); }

    public void incCalls(){         calls.increment(); }
    public void incSuccess(){       success.increment(); }
    public void incAttemptFailed(){ attemptFailed.increment(); }
    public void incExhausted(){     exhausted.increment(); }
    public void incRejected(){      rejected.increment(); }
    public void incReconnect(){     reconnect.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
