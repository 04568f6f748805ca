package org.carball.discovery.pattern;

import org.carball.discovery.analyzer.StatUtils;
import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.pattern.PatternType;
import org.carball.discovery.model.schema.DataType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Detects ordered sequences: constant numeric steps, or strings sharing a prefix with an
 * increasing numeric suffix.
 */
public class SequenceDetector implements PatternDetector {

    static final int MIN_VALUES = 5;
    static final double STEP_TOLERANCE = 0.001;

    private static final java.util.regex.Pattern NUMERIC_SUFFIX = java.util.regex.Pattern.compile("^(.*?)(\\d+)$");

    @Override
    public String name() {
        return "sequence";
    }

    @Override
    public boolean supports(DataType dataType) {
        return dataType == DataType.NUMERIC || dataType == DataType.STRING;
    }

    @Override
    public List<Pattern> detect(String attribute, List<Object> values) {
        if (values.size() < MIN_VALUES) {
            return List.of();
        }
        if (values.get(0) instanceof Number) {
            return detectArithmetic(attribute, StatUtils.numericValues(values));
        }
        return detectStringIncrement(attribute, values);
    }

    private List<Pattern> detectArithmetic(String attribute, double[] series) {
        if (series.length < MIN_VALUES) {
            return List.of();
        }
        double step = series[1] - series[0];
        if (step == 0.0) {
            return List.of();
        }
        for (int i = 2; i < series.length; i++) {
            if (Math.abs((series[i] - series[i - 1]) - step) > STEP_TOLERANCE) {
                return List.of();
            }
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("start", series[0]);
        params.put("step", step);
        return List.of(new Pattern(PatternType.SEQUENCE, "arithmetic", 0.95,
                String.format("%s increases by a constant step of %s", attribute, step), params));
    }

    private List<Pattern> detectStringIncrement(String attribute, List<Object> values) {
        String prefix = null;
        long previous = Long.MIN_VALUE;
        List<Long> suffixes = new ArrayList<>();

        for (Object value : values) {
            if (!(value instanceof String text)) {
                return List.of();
            }
            Matcher matcher = NUMERIC_SUFFIX.matcher(text);
            if (!matcher.matches() || matcher.group(2).length() > 18) {
                return List.of();
            }
            if (prefix == null) {
                prefix = matcher.group(1);
            } else if (!prefix.equals(matcher.group(1))) {
                return List.of();
            }
            long suffix = Long.parseLong(matcher.group(2));
            if (suffix <= previous) {
                return List.of();
            }
            previous = suffix;
            suffixes.add(suffix);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("prefix", prefix);
        params.put("first", suffixes.get(0));
        params.put("last", suffixes.get(suffixes.size() - 1));
        return List.of(new Pattern(PatternType.SEQUENCE, "string_increment", 0.8,
                String.format("%s values follow %s<n> with increasing n", attribute, prefix), params));
    }
}
