package com.connretry.core.predicate;

import com.connretry.core.spi.RetryPredicate;
import com.connretry.model.ctx.RetryContext;
import com.connretry.model.enums.ConnectionMode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPredicatesTest {

    private final RetryContext ctx = new RetryContext(3, ConnectionMode.CHECKED, false, Clock.systemUTC());

    @Test
    void alwaysAndNeverAreConstant() {
        assertThat(RetryPredicates.always().shouldRetry(ctx)).isTrue();
        assertThat(RetryPredicates.never().shouldRetry(ctx)).isFalse();
        assertThat(RetryPredicates.always()).isSameAs(RetryPredicates.always());
    }

    @Test
    void deadlineComparesElapsedTime() {
        Clock frozen = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        RetryContext started = new RetryContext(3, ConnectionMode.CHECKED, false, frozen);

        assertThat(RetryPredicates.withDeadline(Duration.ofSeconds(1)).shouldRetry(started)).isTrue();
        assertThat(RetryPredicates.withDeadline(Duration.ZERO).shouldRetry(started)).isFalse();
    }

    @Test
    void andShortCircuitsOnFirstRejection() {
        AtomicInteger evaluated = new AtomicInteger();
        RetryPredicate counting = c -> {
            evaluated.incrementAndGet();
            return true;
        };

        assertThat(RetryPredicates.and(counting, RetryPredicates.never(), counting).shouldRetry(ctx)).isFalse();
        assertThat(evaluated).hasValue(1);
        assertThat(RetryPredicates.and(counting, counting).shouldRetry(ctx)).isTrue();
        assertThat(RetryPredicates.and().shouldRetry(ctx)).isTrue();
    }

    @Test
    void andRejectsNullMembers() {
        assertThatThrownBy(() -> RetryPredicates.and(RetryPredicates.always(), null))
                .isInstanceOf(NullPointerException.class);
    }
}
