package com.connretry.core.backoff;

import com.connretry.config.RetryConnectorProperties;
import com.connretry.core.spi.BackoffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRegistryTest {

    private RetryConnectorProperties props;
    private RetryConnectorProperties.Backoff backoff;

    @BeforeEach
    void setUp() {
        props = new RetryConnectorProperties();
        backoff = props.getTransientRetry().getBackoff();
        backoff.setBase(Duration.ofMillis(100));
        backoff.setMax(Duration.ofMillis(1000));
        backoff.setJitterRatio(0);
    }

    @Test
    void builtInPoliciesAreRegistered() {
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.names()).contains("fixed", "exponential", "none");
    }

    @Test
    void exponentialDoublesAndIsCappedAtMax() {
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.delayMillis(1)).isEqualTo(100);
        assertThat(registry.delayMillis(2)).isEqualTo(200);
        assertThat(registry.delayMillis(4)).isEqualTo(800);
        assertThat(registry.delayMillis(5)).isEqualTo(1000);
        assertThat(registry.delayMillis(60)).isEqualTo(1000);
    }

    @Test
    void jitterStaysWithinRatioAndBounds() {
        backoff.setJitterRatio(0.5);
        BackoffRegistry registry = new BackoffRegistry(props);

        for (int i = 0; i < 50; i++) {
            assertThat(registry.delayMillis(2)).isBetween(100L, 300L);
        }
    }

    @Test
    void fixedAndNoneStrategies() {
        BackoffRegistry registry = new BackoffRegistry(props);

        backoff.setStrategy("FIXED");
        assertThat(registry.delayMillis(7)).isEqualTo(100);

        backoff.setStrategy("none");
        assertThat(registry.delayMillis(7)).isZero();
    }

    @Test
    void unknownStrategyFallsBackToExponential() {
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.resolve("linear")).isInstanceOf(ExponentialJitterBackoffPolicy.class);
        assertThat(registry.resolve(null)).isInstanceOf(ExponentialJitterBackoffPolicy.class);
    }

    @Test
    void discoveredPolicyIsResolvedBySpiPrefix() {
        BackoffPolicy constant = new BackoffPolicy() {
            @Override
            public String name() {
                return "Constant42";
            }

            @Override
            public long delayMillis(int attempt, RetryConnectorProperties p) {
                return 42;
            }
        };
        BackoffRegistry registry = new BackoffRegistry(props, List.of(constant));
        backoff.setStrategy("spi:constant42");

        assertThat(registry.resolve("spi:Constant42")).isSameAs(constant);
        assertThat(registry.delayMillis(3)).isEqualTo(42);
    }

    @Test
    void maxBelowMinIsRejected() {
        backoff.setMin(Duration.ofSeconds(2));
        backoff.setMax(Duration.ofSeconds(1));

        assertThatThrownBy(() -> new BackoffRegistry(props).afterPropertiesSet())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
