package com.connretry.core.engine;

import com.connretry.core.failure.FailureClassifier;
import com.connretry.core.metric.RetryMetrics;
import com.connretry.core.mode.ConnectionModeController;
import com.connretry.core.spi.ConnectorCallback;
import com.connretry.core.spi.RetryPredicate;
import com.connretry.core.tx.TransactionBoundary;
import com.connretry.model.ctx.RetryContext;
import com.connretry.model.enums.LoopState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * 重试循环
 * <p>
 * RUNNING -> SUCCESS | RETRYING | FATAL。每次失败先入栈计数, 再检查上限, 最后询问判定器;
 * 上限检查先于判定器, 判定器无法突破上限。终止时抛出的始终是最后一次的原始失败。
 */
public class RetryLoopExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryLoopExecutor.class);

    private final ConnectionModeController controller;

    private final TransactionBoundary boundary;

    private final FailureClassifier classifier;

    private final RetryMetrics meter;

    /** 是否打印重试诊断 */
    private final BooleanSupplier debug;

    public RetryLoopExecutor(ConnectionModeController controller,
                             TransactionBoundary boundary,
                             FailureClassifier classifier,
                             RetryMetrics meter,
                             BooleanSupplier debug) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.boundary = Objects.requireNonNull(boundary, "boundary");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.meter = Objects.requireNonNull(meter, "meter");
        this.debug = debug;
    }

    public <T> T execute(RetryContext ctx, boolean transactional,
                         ConnectorCallback<T> callback, RetryPredicate predicate) throws SQLException {
        ConnectorCallback<T> unit = boundary.wrap(transactional, callback);
        while (true) {
            ctx.transition(LoopState.RUNNING);
            T result;
            try {
                result = controller.invoke(ctx.getMode(), unit);
            } catch (SQLException | RuntimeException e) {
                ctx.recordFailure(e, classifier.classify(e));
                meter.incAttemptFailed();

                if (ctx.isCeilingReached()) {
                    ctx.transition(LoopState.FATAL);
                    meter.incExhausted();
                    log.debug("[Retry-Connector] giving up after {} attempts: {}", ctx.getAttemptCount(), e.toString());
                    throw e;
                }

                boolean retry;
                try {
                    retry = predicate.shouldRetry(ctx);
                } catch (RuntimeException predicateErr) {
                    ctx.transition(LoopState.FATAL);
                    meter.incRejected();
                    throw predicateErr;
                }
                if (!retry) {
                    ctx.transition(LoopState.FATAL);
                    meter.incRejected();
                    log.debug("[Retry-Connector] retry rejected after attempt {}: {}", ctx.getAttemptCount(), e.toString());
                    throw e;
                }

                ctx.transition(LoopState.RETRYING);
                if (debug != null && debug.getAsBoolean()) {
                    log.warn("[Retry-Connector] attempt {}/{} failed, retrying. kind={}, err={}",
                            ctx.getAttemptCount(), ctx.getMaxAttempts(), ctx.getLastFailureKind(), e.toString());
                } else {
                    log.debug("[Retry-Connector] attempt {}/{} failed, retrying. kind={}, err={}",
                            ctx.getAttemptCount(), ctx.getMaxAttempts(), ctx.getLastFailureKind(), e.toString());
                }
                continue;
            }
            ctx.transition(LoopState.SUCCESS);
            meter.incSuccess();
            meter.recordAttempts(ctx.getAttemptCount());
            return result;
        }
    }
}
