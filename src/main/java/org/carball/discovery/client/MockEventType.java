package org.carball.discovery.client;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event type served by {@link MockQueryClient}.
 */
@Data
@Builder
public class MockEventType {
    private String name;

    private long recordCount;

    @Builder.Default
    private Map<String, AttributeGenerator> attributes = new LinkedHashMap<>();
}
