package com.connretry.core;

import com.connretry.config.RetryConnectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 启动时打印关键配置, 停止时释放连接句柄
 */
public class RetryConnectorLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RetryConnectorLifecycle.class);

    private final RetryConnector connector;

    private final RetryConnectorProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RetryConnectorLifecycle(RetryConnector connector, RetryConnectorProperties props) {
        this.connector = connector;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("┌──────────────────────────────────────────────");
        log.info("│ RetryConnector started");
        log.info("├──────────────────────────────────────────────");
        log.info("│ maxAttempts            : {}", connector.getMaxAttempts());
        log.info("│ mode                   : {}", connector.getMode());
        log.info("│ debug                  : {}", connector.isDebugLogging());
        log.info("│ probeTimeout           : {} s", props.probeTimeoutSeconds());
        log.info("│ tx.isolation           : {}", props.getTx().getIsolation());
        log.info("│ tx.readOnly            : {}", props.getTx().isReadOnly());
        log.info("│ transientRetry.enabled : {}", props.getTransientRetry().isEnabled());
        if (props.getTransientRetry().isEnabled()) {
            log.info("│ transientRetry.backoff : {}", props.getTransientRetry().getBackoff().getStrategy());
            log.info("│ transientRetry.maxDur  : {}", props.getTransientRetry().getMaxDuration());
        }
        log.info("└──────────────────────────────────────────────");
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Retry-Connector] stop skipped: already stopped");
            return;
        }
        try {
            connector.disconnect();
        } finally {
            log.info("[Retry-Connector] stopped, connection released");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
