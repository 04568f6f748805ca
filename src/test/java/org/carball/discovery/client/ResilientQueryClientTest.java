package org.carball.discovery.client;

import org.carball.discovery.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResilientQueryClientTest {

    private MutableClock clock;
    private MockQueryClient transport;
    private ResilientQueryClient client;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-15T10:00:00Z");
        Map<String, AttributeGenerator> attributes = new LinkedHashMap<>();
        attributes.put("duration", AttributeGenerator.uniform(0.1, 2.0));
        transport = new MockQueryClient(42L, clock)
                .addEventType(MockEventType.builder().name("Transaction").recordCount(5000).attributes(attributes).build());

        Sleeper noWait = duration -> { };
        RateLimiter rateLimiter = new RateLimiter(1000, 1000, Duration.ofMinutes(1), clock, noWait);
        RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), 2.0, 0.1,
                new Random(3), noWait);
        CircuitBreaker breaker = new CircuitBreaker(3, 1, Duration.ofSeconds(30), 1, clock);
        client = new ResilientQueryClient(transport, rateLimiter, retryPolicy, breaker);
    }

    @Test
    public void shouldPassThroughSuccessfulQueries() throws QueryException {
        // When
        QueryResult result = client.query("SELECT count(*) FROM Transaction");

        // Then
        assertThat(result.firstLong("count")).isEqualTo(5000);
        assertThat(client.getStats().queryCount()).isEqualTo(1);
        assertThat(client.getStats().errorCount()).isZero();
    }

    @Test
    public void shouldFailFastOnceCircuitOpens() {
        // Given
        transport.setShouldFail(true);
        transport.setFailureStatus(503);

        // When
        assertThatThrownBy(() -> client.query("SELECT count(*) FROM Transaction"))
                .isInstanceOf(RetriesExhaustedException.class);

        // Then
        assertThat(transport.getQueryCount()).isEqualTo(3);
        assertThat(client.getCircuitBreaker().getState()).isEqualTo(CircuitState.OPEN);
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> client.query("SELECT count(*) FROM Transaction"))
                    .isInstanceOf(CircuitOpenException.class);
        }
        assertThat(transport.getQueryCount()).isEqualTo(3);
        assertThat(client.getStats().circuitRejections()).isEqualTo(5);
        assertThat(client.getStats().errorCount()).isEqualTo(6);
    }

    @Test
    public void shouldRecoverAfterCooldown() throws QueryException {
        // Given
        transport.setShouldFail(true);
        assertThatThrownBy(() -> client.query("SELECT count(*) FROM Transaction"))
                .isInstanceOf(QueryException.class);
        transport.setShouldFail(false);

        // When
        clock.advance(Duration.ofSeconds(31));
        QueryResult result = client.query("SELECT count(*) FROM Transaction");

        // Then
        assertThat(result.firstLong("count")).isEqualTo(5000);
        assertThat(client.getCircuitBreaker().getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    public void shouldNotRetryPermanentErrors() {
        // Given
        transport.setShouldFail(true);
        transport.setFailureStatus(401);

        // When/Then
        assertThatThrownBy(() -> client.query("SELECT count(*) FROM Transaction"))
                .isInstanceOf(PermanentQueryException.class)
                .hasMessageContaining("401");
        assertThat(transport.getQueryCount()).isEqualTo(1);
        assertThat(client.getRetryPolicy().getTotalRetries()).isZero();
    }

    @Test
    public void shouldReleaseHalfOpenPermitWhenQueryIsCancelled() {
        // Given a half-open breaker with a single permit
        CircuitBreaker breaker = new CircuitBreaker(1, 1, Duration.ofSeconds(30), 1, clock);
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(31));
        QueryClient cancelling = nrql -> {
            throw new QueryCancelledException("Cancelled by caller", new InterruptedException());
        };
        Sleeper noWait = duration -> { };
        ResilientQueryClient cancelledClient = new ResilientQueryClient(cancelling,
                new RateLimiter(1000, 1000, Duration.ofMinutes(1), clock, noWait),
                new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), 2.0, 0.1, new Random(3), noWait),
                breaker);

        // When
        assertThatThrownBy(() -> cancelledClient.query("SELECT count(*) FROM Transaction"))
                .isInstanceOf(QueryCancelledException.class);

        // Then
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.allowRequest()).isTrue();
    }
}
