package org.carball.discovery.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.engine.DiscoveryEngine;
import org.carball.discovery.model.discovery.CrossSchemaPattern;
import org.carball.discovery.model.discovery.DiscoveryResult;
import org.carball.discovery.model.discovery.ExecutionPlan;
import org.carball.discovery.model.discovery.Insight;
import org.carball.discovery.model.discovery.SchemaFailure;
import org.carball.discovery.model.relationship.Relationship;
import org.carball.discovery.model.schema.Schema;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a discovery result as JSON or Markdown.
 */
@Slf4j
public class DiscoveryReport {

    private final DiscoveryResult result;
    private final Instant generatedAt;
    private final ObjectMapper objectMapper;

    public DiscoveryReport(DiscoveryResult result, Clock clock) {
        this.result = result;
        this.generatedAt = clock.instant();
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON discovery report", e);
            throw new IllegalStateException("Failed to generate JSON discovery report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Telemetry Discovery Report\n\n");
        md.append("**Generated:** ").append(generatedAt).append("  \n");
        md.append("**Engine Version:** ").append(DiscoveryEngine.VERSION).append("  \n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        summary().forEach((metric, value) ->
                md.append("| ").append(metric).append(" | ").append(value).append(" |\n"));
        md.append("\n");

        md.append("## Schemas\n\n");
        if (result.schemas().isEmpty()) {
            md.append("**No event types met the discovery criteria.**\n\n");
        } else {
            md.append("| Event Type | Records | Attributes | Patterns | Quality |\n");
            md.append("|------------|---------|------------|----------|---------|\n");
            for (Schema schema : result.schemas()) {
                md.append("| ").append(schema.getName())
                        .append(" | ").append(schema.getDataVolume().totalRecords())
                        .append(" | ").append(schema.getAttributes().size())
                        .append(" | ").append(schema.getPatterns().size())
                        .append(" | ").append(String.format("%.2f", schema.getQuality().overallScore()))
                        .append(" |\n");
            }
            md.append("\n");
        }

        if (!result.relationships().isEmpty()) {
            md.append("## Relationships\n\n");
            for (Relationship relationship : result.relationships()) {
                md.append("- **").append(relationship.type().getValue()).append("** `")
                        .append(relationship.sourceSchema()).append('.').append(relationship.sourceAttribute())
                        .append("` → `")
                        .append(relationship.targetSchema()).append('.').append(relationship.targetAttribute())
                        .append("` (confidence ").append(String.format("%.2f", relationship.confidence()))
                        .append(")\n");
            }
            md.append("\n");
        }

        if (!result.patterns().isEmpty()) {
            md.append("## Cross-Schema Patterns\n\n");
            for (CrossSchemaPattern pattern : result.patterns()) {
                md.append("- ").append(pattern.name()).append(": ").append(pattern.description()).append("\n");
            }
            md.append("\n");
        }

        if (!result.insights().isEmpty()) {
            md.append("## Insights\n\n");
            for (Insight insight : result.insights()) {
                md.append("### ").append(insight.title()).append("\n\n");
                md.append("- **Severity:** ").append(insight.severity()).append("\n");
                md.append("- **Type:** ").append(insight.type()).append("\n");
                md.append("- ").append(insight.description()).append("\n");
                if (insight.actions() != null) {
                    insight.actions().forEach(action -> md.append("  - ").append(action).append("\n"));
                }
                md.append("\n");
            }
        }

        if (!result.recommendations().isEmpty()) {
            md.append("## Recommendations\n\n");
            int number = 1;
            for (String recommendation : result.recommendations()) {
                md.append(number++).append(". ").append(recommendation).append("\n");
            }
            md.append("\n");
        }

        ExecutionPlan plan = result.executionPlan();
        if (plan != null && !plan.steps().isEmpty()) {
            md.append("## Execution Plan\n\n");
            md.append("Estimated total: ").append(plan.totalTime()).append(", parallelism ")
                    .append(plan.parallelism()).append("\n\n");
            plan.steps().forEach(step -> md.append("- ").append(step.name()).append(" (")
                    .append(step.type()).append(", ").append(step.estimate()).append(")\n"));
            md.append("\n");
        }

        if (!result.failures().isEmpty()) {
            md.append("## Failed Event Types\n\n");
            for (SchemaFailure failure : result.failures()) {
                md.append("- `").append(failure.eventType()).append("`: ")
                        .append(failure.errorType()).append(" - ").append(failure.message()).append("\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("Schemas Discovered", result.schemas().size());
        summary.put("Relationships Found", result.relationships().size());
        summary.put("Cross-Schema Patterns", result.patterns().size());
        summary.put("Insights", result.insights().size());
        summary.put("Failed Event Types", result.failures().size());
        return summary;
    }

    private ReportData buildReportData() {
        return new ReportData(generatedAt, DiscoveryEngine.VERSION, summary(), result.schemas(),
                result.relationships(), result.patterns(), result.insights(), result.recommendations(),
                result.executionPlan(), result.failures(), result.metadata());
    }

    public record ReportData(
        Instant generatedAt,
        String engineVersion,
        Map<String, Object> summary,
        List<Schema> schemas,
        List<Relationship> relationships,
        List<CrossSchemaPattern> patterns,
        List<Insight> insights,
        List<String> recommendations,
        ExecutionPlan executionPlan,
        List<SchemaFailure> failures,
        Map<String, Object> metadata
    ) {}
}
