package com.connretry.core.backoff;

import com.connretry.config.RetryConnectorProperties;
import com.connretry.core.spi.BackoffPolicy;

/**
 * 立即重试
 */
public class NoBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "none";
    }

    @Override
    public long delayMillis(int attempt, RetryConnectorProperties props) {
        return 0;
    }
}
