package org.carball.discovery.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RetryPolicyTest {

    private List<Duration> sleeps;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        policy = new RetryPolicy(4, Duration.ofMillis(100), Duration.ofMillis(300), 2.0, 0.1,
                new Random(7), sleeps::add);
    }

    @Test
    public void shouldRetryTransientFailuresUntilSuccess() throws QueryException {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientQueryException("connection reset");
            }
            return "ok";
        });

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
        assertThat(policy.getTotalRetries()).isEqualTo(2);
        assertThat(policy.getSuccessfulCalls()).isEqualTo(1);
    }

    @Test
    public void shouldNotRetryPermanentFailures() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When/Then
        assertThatThrownBy(() -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new PermanentQueryException("NRDB query failed with HTTP 401", 401, null);
        })).isInstanceOf(PermanentQueryException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    public void shouldStopAfterMaxAttemptsWithBoundedBackoff() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When/Then
        assertThatThrownBy(() -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new TransientQueryException("HTTP 503", 503, null);
        }))
                .isInstanceOf(RetriesExhaustedException.class)
                .hasMessageContaining("failed after 4 attempts");

        assertThat(calls).hasValue(4);
        assertThat(sleeps).hasSize(3).allSatisfy(sleep ->
                assertThat(sleep).isLessThanOrEqualTo(Duration.ofMillis(300)));
        assertThat(policy.getTotalBackoff().toMillis())
                .isLessThanOrEqualTo(policy.getMaxAttempts() * policy.getMaxInterval().toMillis());
        assertThat(policy.getFailedCalls()).isEqualTo(1);
    }

    @Test
    public void shouldGrowBackoffExponentiallyWithinJitter() {
        // When
        Duration first = policy.backoff(0);
        Duration second = policy.backoff(1);
        Duration capped = policy.backoff(5);

        // Then
        assertThat(first.toMillis()).isBetween(90L, 110L);
        assertThat(second.toMillis()).isBetween(180L, 220L);
        assertThat(capped.toMillis()).isBetween(270L, 300L);
    }

    @Test
    public void shouldTurnInterruptedBackoffIntoCancellation() {
        // Given
        RetryPolicy interrupting = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(10), 2.0, 0.0,
                new Random(1), duration -> {
                    throw new InterruptedException("stop");
                });

        // When/Then
        assertThatThrownBy(() -> interrupting.execute(() -> {
            throw new TransientQueryException("timeout");
        })).isInstanceOf(QueryCancelledException.class);
        assertThat(Thread.interrupted()).isTrue();
    }
}
