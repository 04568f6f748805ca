package org.carball.discovery.model.quality;

import java.util.List;

public record AttributeQuality(double score, double completeness, double validity, List<String> issues) {}
