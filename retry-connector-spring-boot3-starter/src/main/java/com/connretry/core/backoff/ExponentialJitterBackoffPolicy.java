package com.connretry.core.backoff;

import com.connretry.config.RetryConnectorProperties;
import com.connretry.core.spi.BackoffPolicy;

import java.util.concurrent.ThreadLocalRandom;

public class ExponentialJitterBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long delayMillis(int attempt, RetryConnectorProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getTransientRetry().getBackoff().getJitterRatio();

        // attempt从1开始计数：1 -> base, 2 -> base * 2, 3 -> base * 4 ...
        double pow = Math.pow(2.0, Math.max(0, attempt - 1));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        long jittered = ideal;
        if (jr > 0 && ideal > 0) {
            jittered = ideal + Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal);
        }
        return Math.max(0, Math.max(min, Math.min(jittered, max)));
    }
}
