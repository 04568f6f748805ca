package org.carball.discovery.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.discovery.MutableClock;
import org.carball.discovery.model.discovery.CrossSchemaPattern;
import org.carball.discovery.model.discovery.DiscoveryResult;
import org.carball.discovery.model.discovery.ExecutionPlan;
import org.carball.discovery.model.discovery.ExecutionStep;
import org.carball.discovery.model.discovery.Insight;
import org.carball.discovery.model.discovery.SchemaFailure;
import org.carball.discovery.model.quality.Severity;
import org.carball.discovery.model.relationship.Evidence;
import org.carball.discovery.model.relationship.Relationship;
import org.carball.discovery.model.relationship.RelationshipType;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.DataType;
import org.carball.discovery.model.schema.DataVolumeProfile;
import org.carball.discovery.model.schema.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class DiscoveryReportTest {

    private MutableClock clock;
    private DiscoveryResult result;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-15T10:00:00Z");

        Schema transaction = Schema.builder()
                .id(Schema.idFor("Transaction"))
                .name("Transaction")
                .eventType("Transaction")
                .attributes(new ArrayList<>(List.of(
                        Attribute.builder().name("sessionId").dataType(DataType.STRING).build(),
                        Attribute.builder().name("duration").dataType(DataType.NUMERIC).build())))
                .dataVolume(new DataVolumeProfile(1_000_000, 1_000_000, 24_000_000, 0.0, 30, 12.5))
                .discoveredAt(Instant.parse("2024-01-15T09:59:00Z"))
                .build();

        Relationship join = Relationship.builder()
                .type(RelationshipType.JOIN)
                .sourceSchema("Transaction")
                .sourceAttribute("sessionId")
                .targetSchema("PageView")
                .targetAttribute("sessionId")
                .confidence(0.82)
                .evidence(List.of(new Evidence("match_ratio", 0.96, 0.96, "96% of sampled values match")))
                .build();

        Insight insight = Insight.builder()
                .id("quality-Transaction")
                .type("data_quality")
                .severity(Severity.WARNING)
                .title("Low data quality in Transaction")
                .description("Schema Transaction has quality score of 0.62")
                .actions(List.of("Review data collection for this schema"))
                .build();

        ExecutionPlan plan = new ExecutionPlan(
                List.of(new ExecutionStep("Profile schemas", "discovery", Duration.ofMinutes(2), "completed", "1 schema")),
                Duration.ofMinutes(2), 4);

        result = DiscoveryResult.builder()
                .schemas(List.of(transaction))
                .relationships(List.of(join))
                .patterns(List.of(new CrossSchemaPattern("Common attribute: sessionId", "common_attribute",
                        List.of("Transaction", "PageView"), 0.9, "Attribute 'sessionId' appears in 2 schemas")))
                .insights(List.of(insight))
                .recommendations(List.of("Join Transaction and PageView on sessionId"))
                .executionPlan(plan)
                .failures(List.of(new SchemaFailure("Empty", "DiscoveryException", "No data for Empty")))
                .metadata(Map.of("schemas_found", 1))
                .build();
    }

    @Test
    public void shouldRenderJsonWithIsoTimes() throws Exception {
        // When
        String json = new DiscoveryReport(result, clock).toJson();

        // Then
        JsonNode root = new ObjectMapper().readTree(json);
        assertThat(root.get("generatedAt").asText()).isEqualTo("2024-01-15T10:00:00Z");
        assertThat(root.get("engineVersion").asText()).isEqualTo("1.0.0");
        assertThat(root.get("summary").get("Schemas Discovered").asInt()).isEqualTo(1);
        assertThat(root.get("schemas").get(0).get("name").asText()).isEqualTo("Transaction");
        assertThat(root.get("schemas").get(0).get("discoveredAt").asText()).isEqualTo("2024-01-15T09:59:00Z");
        assertThat(root.get("schemas").get(0).has("lastAnalyzedAt")).isFalse();
        assertThat(root.get("relationships").get(0).get("type").asText()).isEqualTo("JOIN");
        assertThat(root.get("executionPlan").get("totalTime").asText()).isEqualTo("PT2M");
        assertThat(root.get("failures").get(0).get("eventType").asText()).isEqualTo("Empty");
    }

    @Test
    public void shouldRenderMarkdownSections() {
        // When
        String markdown = new DiscoveryReport(result, clock).toMarkdown();

        // Then
        assertThat(markdown).startsWith("# Telemetry Discovery Report");
        assertThat(markdown).contains("| Schemas Discovered | 1 |");
        assertThat(markdown).contains("| Transaction | 1000000 | 2 | 0 | 0.00 |");
        assertThat(markdown).contains("**join** `Transaction.sessionId` → `PageView.sessionId` (confidence 0.82)");
        assertThat(markdown).contains("### Low data quality in Transaction");
        assertThat(markdown).contains("1. Join Transaction and PageView on sessionId");
        assertThat(markdown).contains("- `Empty`: DiscoveryException - No data for Empty");
    }

    @Test
    public void shouldNoteEmptyDiscovery() {
        // Given
        DiscoveryResult empty = DiscoveryResult.builder()
                .schemas(List.of())
                .relationships(List.of())
                .patterns(List.of())
                .insights(List.of())
                .recommendations(List.of())
                .failures(List.of())
                .metadata(Map.of())
                .build();

        // When
        String markdown = new DiscoveryReport(empty, clock).toMarkdown();

        // Then
        assertThat(markdown).contains("**No event types met the discovery criteria.**");
        assertThat(markdown).doesNotContain("## Relationships");
        assertThat(markdown).doesNotContain("## Execution Plan");
    }
}
