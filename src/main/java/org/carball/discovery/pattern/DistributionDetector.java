package org.carball.discovery.pattern;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.analyzer.StatUtils;
import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.pattern.PatternType;
import org.carball.discovery.model.schema.DataType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fits numeric samples against normal, uniform and power-law shapes and reports the best fit.
 */
@Slf4j
public class DistributionDetector implements PatternDetector {

    static final int MIN_SAMPLES = 30;
    static final double MIN_CONFIDENCE = 0.6;
    static final int UNIFORM_BUCKETS = 10;
    // chi-square critical value, 9 degrees of freedom, p = 0.05
    static final double UNIFORM_CHI_SQUARE_CRITICAL = 16.92;
    static final double POWER_LAW_MIN_R_SQUARED = 0.9;

    @Override
    public String name() {
        return "distribution";
    }

    @Override
    public boolean supports(DataType dataType) {
        return dataType == DataType.NUMERIC;
    }

    @Override
    public List<Pattern> detect(String attribute, List<Object> values) {
        double[] data = StatUtils.numericValues(values);
        if (data.length < MIN_SAMPLES || StatUtils.variance(data) == 0.0) {
            return List.of();
        }

        List<Pattern> fits = new ArrayList<>();
        testNormal(attribute, data).ifPresent(fits::add);
        testUniform(attribute, data).ifPresent(fits::add);
        testPowerLaw(attribute, data).ifPresent(fits::add);

        Optional<Pattern> best = fits.stream()
                .filter(p -> p.confidence() >= MIN_CONFIDENCE)
                .max(Comparator.comparingDouble(Pattern::confidence));
        best.ifPresent(p -> log.debug("Best distribution fit for {}: {} ({})", attribute, p.subtype(), p.confidence()));
        return best.map(List::of).orElse(List.of());
    }

    Optional<Pattern> testNormal(String attribute, double[] data) {
        double skew = StatUtils.skewness(data);
        double kurtosis = StatUtils.excessKurtosis(data);
        if (Math.abs(skew) >= 0.5 || Math.abs(kurtosis) >= 1.0) {
            return Optional.empty();
        }

        double confidence = 1.0 - 0.25 * (Math.abs(skew) / 0.5) - 0.25 * Math.abs(kurtosis);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("mean", StatUtils.mean(data));
        params.put("std_dev", StatUtils.stdDev(data));
        params.put("skewness", skew);
        params.put("excess_kurtosis", kurtosis);

        return Optional.of(new Pattern(PatternType.DISTRIBUTION, "normal", confidence,
                String.format("%s is approximately normally distributed", attribute), params));
    }

    Optional<Pattern> testUniform(String attribute, double[] data) {
        double[] sorted = StatUtils.sorted(data);
        double min = sorted[0];
        double width = (sorted[sorted.length - 1] - min) / UNIFORM_BUCKETS;

        int[] counts = new int[UNIFORM_BUCKETS];
        for (double v : data) {
            int bucket = (int) ((v - min) / width);
            counts[Math.min(UNIFORM_BUCKETS - 1, bucket)]++;
        }

        double expected = (double) data.length / UNIFORM_BUCKETS;
        double chiSquare = 0.0;
        for (int count : counts) {
            chiSquare += (count - expected) * (count - expected) / expected;
        }
        if (chiSquare >= UNIFORM_CHI_SQUARE_CRITICAL) {
            return Optional.empty();
        }

        double confidence = 1.0 - 0.4 * chiSquare / UNIFORM_CHI_SQUARE_CRITICAL;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("min", min);
        params.put("max", sorted[sorted.length - 1]);
        params.put("chi_square", chiSquare);

        return Optional.of(new Pattern(PatternType.DISTRIBUTION, "uniform", confidence,
                String.format("%s is approximately uniformly distributed", attribute), params));
    }

    /**
     * Regresses the log complementary CDF on log value; a straight line with a long right tail
     * indicates a power law.
     */
    Optional<Pattern> testPowerLaw(String attribute, double[] data) {
        double[] sorted = StatUtils.sorted(data);
        if (sorted[0] <= 0.0 || StatUtils.skewness(data) <= 1.0) {
            return Optional.empty();
        }

        int n = sorted.length;
        List<double[]> points = new ArrayList<>();
        int rank = 0;
        while (rank < n) {
            // share of values >= sorted[rank]
            double ccdf = (double) (n - rank) / n;
            points.add(new double[]{Math.log(sorted[rank]), Math.log(ccdf)});
            int next = rank;
            while (next < n && sorted[next] == sorted[rank]) {
                next++;
            }
            rank = next;
        }
        if (points.size() < 5) {
            return Optional.empty();
        }

        double[] x = new double[points.size()];
        double[] y = new double[points.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = points.get(i)[0];
            y[i] = points.get(i)[1];
        }
        StatUtils.LinearFit fit = StatUtils.linearRegression(x, y);
        if (fit.slope() >= 0.0 || fit.rSquared() <= POWER_LAW_MIN_R_SQUARED) {
            return Optional.empty();
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("exponent", 1.0 - fit.slope());
        params.put("r_squared", fit.rSquared());
        params.put("x_min", sorted[0]);

        return Optional.of(new Pattern(PatternType.DISTRIBUTION, "power_law", fit.rSquared(),
                String.format("%s follows a power law (exponent %.2f)", attribute, 1.0 - fit.slope()), params));
    }
}
