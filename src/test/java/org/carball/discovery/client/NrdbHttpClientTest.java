package org.carball.discovery.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.discovery.config.DiscoveryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NrdbHttpClientTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = NrdbHttpClient.createObjectMapper();
    }

    @Test
    public void shouldParseResultsMetadataAndPerformance() throws QueryException {
        // Given
        String body = """
                {
                  "results": [{"count": 1234, "appName": "checkout"}],
                  "metadata": {"eventTypes": ["Transaction"], "messages": ["sampled"], "contents": [{"function": "count"}]},
                  "performanceInfo": {"inspectedCount": 98765, "wallClockTime": 42},
                  "unexpected": true
                }
                """;

        // When
        QueryResult result = NrdbHttpClient.parseResponse(mapper, body);

        // Then
        assertThat(result.firstLong("count")).isEqualTo(1234);
        assertThat(result.results().get(0)).containsEntry("appName", "checkout");
        assertThat(result.metadata().eventTypes()).containsExactly("Transaction");
        assertThat(result.metadata().messages()).containsExactly("sampled");
        assertThat(result.metadata().contents()).hasSize(1);
        assertThat(result.performanceInfo().inspectedCount()).isEqualTo(98765);
        assertThat(result.performanceInfo().wallClockTimeMillis()).isEqualTo(42);
    }

    @Test
    public void shouldTolerateMissingSections() throws QueryException {
        // When
        QueryResult result = NrdbHttpClient.parseResponse(mapper, "{}");

        // Then
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.firstLong("count")).isZero();
        assertThat(result.metadata().eventTypes()).isEmpty();
        assertThat(result.performanceInfo()).isNull();
    }

    @Test
    public void shouldRejectErrorResponses() {
        assertThatThrownBy(() -> NrdbHttpClient.parseResponse(mapper, "{\"error\": \"NRQL Syntax Error\"}"))
                .isInstanceOf(PermanentQueryException.class)
                .hasMessageContaining("NRQL Syntax Error");
    }

    @Test
    public void shouldRejectMalformedBodies() {
        assertThatThrownBy(() -> NrdbHttpClient.parseResponse(mapper, "not json"))
                .isInstanceOf(PermanentQueryException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> NrdbHttpClient.parseResponse(mapper, "[1, 2]"))
                .isInstanceOf(PermanentQueryException.class);
    }

    @Test
    public void shouldRequireCredentials() {
        assertThatThrownBy(() -> new NrdbHttpClient(DiscoveryConfig.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("API key is required");
    }

    @Test
    public void shouldReportConfiguredAccount() {
        // Given
        DiscoveryConfig config = DiscoveryConfig.builder().apiKey("NRAK-test").accountId("999").build();

        // When
        NrdbHttpClient client = new NrdbHttpClient(config);

        // Then
        assertThat(client.getAccountInfo().accountId()).isEqualTo("999");
    }
}
