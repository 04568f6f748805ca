package org.carball.discovery.model.discovery;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class DiscoveryHints {
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String purpose;

    private String domain;

    @Builder.Default
    private List<String> preferredTypes = new ArrayList<>();

    @Builder.Default
    private List<String> examples = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> constraints = new HashMap<>();
}
