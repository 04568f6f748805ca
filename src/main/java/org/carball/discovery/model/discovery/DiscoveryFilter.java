package org.carball.discovery.model.discovery;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied constraints on which event types are discovered.
 * Patterns support a leading and/or trailing {@code *} wildcard.
 */
@Data
@Builder(toBuilder = true)
public class DiscoveryFilter {
    @Builder.Default
    private List<String> eventTypes = new ArrayList<>();

    @Builder.Default
    private List<String> includePatterns = new ArrayList<>();

    @Builder.Default
    private List<String> excludePatterns = new ArrayList<>();

    private long minRecordCount;

    private int maxSchemas;

    private Duration lookback;

    public static DiscoveryFilter all() {
        return DiscoveryFilter.builder().build();
    }

    public boolean matches(String eventType) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(eventType)) {
            return false;
        }
        if (!includePatterns.isEmpty()
                && includePatterns.stream().noneMatch(p -> matchesPattern(eventType, p))) {
            return false;
        }
        return excludePatterns.stream().noneMatch(p -> matchesPattern(eventType, p));
    }

    public String cacheKey() {
        return "schemas:" + eventTypes + "|" + includePatterns + "|" + excludePatterns
                + "|" + minRecordCount + "|" + maxSchemas + "|" + lookback;
    }

    public static boolean matchesPattern(String value, String pattern) {
        if ("*".equals(pattern)) {
            return true;
        }
        boolean leading = pattern.startsWith("*");
        boolean trailing = pattern.endsWith("*") && pattern.length() > 1;
        String core = pattern.substring(leading ? 1 : 0, pattern.length() - (trailing ? 1 : 0));
        if (leading && trailing) {
            return value.contains(core);
        }
        if (leading) {
            return value.endsWith(core);
        }
        if (trailing) {
            return value.startsWith(core);
        }
        return value.equals(pattern);
    }
}
