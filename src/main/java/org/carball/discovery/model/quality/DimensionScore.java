package org.carball.discovery.model.quality;

import java.util.List;
import java.util.Map;

public record DimensionScore(double score, Map<String, Object> details, List<String> issues) {}
