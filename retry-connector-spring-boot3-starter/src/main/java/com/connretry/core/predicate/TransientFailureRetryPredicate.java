package com.connretry.core.predicate;

import com.connretry.core.backoff.BackoffRegistry;
import com.connretry.core.spi.RetryPredicate;
import com.connretry.model.ctx.RetryContext;
import com.connretry.model.enums.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 只重试瞬时失败的判定器
 * <p>
 * 死锁、锁等待超时、连接丢失以及事务回滚失败（通常意味着事务中途断线）会被重试,
 * 重试前按退避策略等待; 业务失败直接拒绝。可选总耗时上限。
 */
public class TransientFailureRetryPredicate implements RetryPredicate {

    private static final Logger log = LoggerFactory.getLogger(TransientFailureRetryPredicate.class);

    private static final Set<FailureKind> RETRYABLE =
            EnumSet.of(FailureKind.TRANSIENT, FailureKind.CONNECTION, FailureKind.TXN_ROLLBACK);

    private final BackoffRegistry backoff;

    /** 总耗时上限, null 或 0 表示不限 */
    private final Duration maxDuration;

    private final Sleeper sleeper;

    public TransientFailureRetryPredicate(BackoffRegistry backoff, Duration maxDuration) {
        this(backoff, maxDuration, TimeUnit.MILLISECONDS::sleep);
    }

    public TransientFailureRetryPredicate(BackoffRegistry backoff, Duration maxDuration, Sleeper sleeper) {
        this.backoff = backoff;
        this.maxDuration = maxDuration;
        this.sleeper = sleeper;
    }

    @Override
    public boolean shouldRetry(RetryContext ctx) {
        FailureKind kind = ctx.getLastFailureKind();
        if (kind == null || !RETRYABLE.contains(kind)) {
            log.debug("[Transient-Retry] not retryable, kind={}, err={}", kind, ctx.getLastException());
            return false;
        }
        long delay = backoff.delayMillis(ctx.getAttemptCount());
        if (maxDuration != null && !maxDuration.isZero() && !maxDuration.isNegative()
                && ctx.getElapsed().plusMillis(delay).compareTo(maxDuration) > 0) {
            log.debug("[Transient-Retry] time budget {} exhausted after {} attempts", maxDuration, ctx.getAttemptCount());
            return false;
        }
        if (delay > 0) {
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.debug("[Transient-Retry] interrupted while backing off, stop retrying");
                return false;
            }
        }
        return true;
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    /** 退避等待 */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
