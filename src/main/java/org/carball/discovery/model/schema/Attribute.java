package org.carball.discovery.model.schema;

import lombok.Builder;
import lombok.Data;
import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.quality.AttributeQuality;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class Attribute {
    private String name;

    @Builder.Default
    private DataType dataType = DataType.UNKNOWN;

    @Builder.Default
    private SemanticType semanticType = SemanticType.CUSTOM;

    @Builder.Default
    private CardinalityProfile cardinality = CardinalityProfile.empty();

    @Builder.Default
    private Statistics statistics = Statistics.empty();

    private double nullRatio;

    @Builder.Default
    private List<Pattern> patterns = new ArrayList<>();

    private AttributeQuality quality;

    @Builder.Default
    private List<Object> sampleValues = new ArrayList<>();

    public Attribute copy() {
        return toBuilder()
                .patterns(new ArrayList<>(patterns))
                .sampleValues(new ArrayList<>(sampleValues))
                .build();
    }

    public boolean isNumeric() {
        return dataType == DataType.NUMERIC;
    }

    public boolean isTemporal() {
        return dataType == DataType.TIMESTAMP || "timestamp".equals(name);
    }
}
