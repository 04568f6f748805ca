package org.carball.discovery.pattern;

import org.carball.discovery.analyzer.ValueFormat;
import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.pattern.PatternType;
import org.carball.discovery.model.schema.DataType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports a format pattern when at least 80% of string values share one recognizable format.
 */
public class FormatDetector implements PatternDetector {

    static final int MIN_VALUES = 5;
    static final double MIN_MATCH_RATIO = 0.8;

    private static final List<ValueFormat> FORMATS = List.of(
            ValueFormat.EMAIL,
            ValueFormat.URL,
            ValueFormat.IP_ADDRESS,
            ValueFormat.UUID,
            ValueFormat.JSON,
            ValueFormat.TIMESTAMP);

    @Override
    public String name() {
        return "format";
    }

    @Override
    public boolean supports(DataType dataType) {
        return dataType == DataType.STRING || dataType == DataType.TIMESTAMP;
    }

    @Override
    public List<Pattern> detect(String attribute, List<Object> values) {
        List<String> strings = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof String text) {
                strings.add(text);
            }
        }
        if (strings.size() < MIN_VALUES) {
            return List.of();
        }

        List<Pattern> patterns = new ArrayList<>();
        for (ValueFormat format : FORMATS) {
            long matches = strings.stream().filter(format::matches).count();
            double ratio = (double) matches / strings.size();
            if (ratio >= MIN_MATCH_RATIO) {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("format", format.getValue());
                params.put("match_ratio", ratio);
                params.put("sample_size", strings.size());
                patterns.add(new Pattern(PatternType.FORMAT, format.getValue(), ratio,
                        String.format("%.0f%% of %s values are %s", ratio * 100, attribute, format.getValue()),
                        params));
            }
        }
        return patterns;
    }
}
