package org.carball.discovery.model.schema;

import lombok.Builder;
import lombok.Data;
import org.carball.discovery.model.pattern.DetectedPattern;
import org.carball.discovery.model.quality.QualityMetrics;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A discovered event type. Callers own the instance they receive; cached schemas are handed out as copies.
 */
@Data
@Builder(toBuilder = true)
public class Schema {
    private String id;
    private String name;
    private String eventType;

    @Builder.Default
    private List<Attribute> attributes = new ArrayList<>();

    private long sampleCount;

    @Builder.Default
    private DataVolumeProfile dataVolume = DataVolumeProfile.unknown();

    @Builder.Default
    private QualityMetrics quality = QualityMetrics.unassessed();

    @Builder.Default
    private List<DetectedPattern> patterns = new ArrayList<>();

    private Instant discoveredAt;
    private Instant lastAnalyzedAt;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * Copy whose attributes, pattern list and metadata map can be changed without touching this schema.
     */
    public Schema copy() {
        List<Attribute> copiedAttributes = new ArrayList<>(attributes.size());
        attributes.forEach(attribute -> copiedAttributes.add(attribute.copy()));
        return toBuilder()
                .attributes(copiedAttributes)
                .patterns(new ArrayList<>(patterns))
                .metadata(new HashMap<>(metadata))
                .build();
    }

    public Optional<Attribute> findAttribute(String attributeName) {
        return attributes.stream()
                .filter(a -> a.getName().equals(attributeName))
                .findFirst();
    }

    public boolean hasTimestamp() {
        return attributes.stream().anyMatch(Attribute::isTemporal);
    }

    /**
     * Stable identifier derived from the event type name.
     */
    public static String idFor(String eventType) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(eventType.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
