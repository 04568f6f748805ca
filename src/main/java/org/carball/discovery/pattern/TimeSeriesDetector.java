package org.carball.discovery.pattern;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.analyzer.StatUtils;
import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.pattern.PatternType;
import org.carball.discovery.model.schema.DataType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Trend, seasonality, anomaly and change-point detection on numeric series.
 */
@Slf4j
public class TimeSeriesDetector implements PatternDetector {

    static final int MIN_POINTS = 10;
    static final double TREND_MIN_R_SQUARED = 0.5;
    static final double TREND_MIN_T_STATISTIC = 2.0;
    static final double SEASONALITY_MIN_STRENGTH = 0.5;
    static final double ANOMALY_Z_THRESHOLD = 3.0;
    static final double CHANGE_POINT_VARIANCE_RATIO = 4.0;
    static final int MIN_SEGMENT = 5;
    private static final double EPSILON = 1e-9;

    @Override
    public String name() {
        return "time_series";
    }

    @Override
    public boolean supports(DataType dataType) {
        return dataType == DataType.NUMERIC;
    }

    @Override
    public List<Pattern> detect(String attribute, List<Object> values) {
        double[] series = StatUtils.numericValues(values);
        if (series.length < MIN_POINTS) {
            return List.of();
        }

        List<Pattern> patterns = new ArrayList<>();
        detectTrend(attribute, series).ifPresent(patterns::add);
        detectSeasonality(attribute, series).ifPresent(patterns::add);
        detectAnomalies(attribute, series).ifPresent(patterns::add);
        detectChangePoint(attribute, series).ifPresent(patterns::add);

        log.debug("Time series detector found {} patterns on {}", patterns.size(), attribute);
        return patterns;
    }

    Optional<Pattern> detectTrend(String attribute, double[] series) {
        StatUtils.LinearFit fit = StatUtils.linearRegression(series);
        double t = Math.abs(fit.slopeTStatistic());
        if (fit.rSquared() <= TREND_MIN_R_SQUARED || t <= TREND_MIN_T_STATISTIC) {
            return Optional.empty();
        }

        String direction = fit.slope() > 0 ? "increasing" : "decreasing";
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("slope", fit.slope());
        params.put("intercept", fit.intercept());
        params.put("r_squared", fit.rSquared());
        params.put("t_statistic", t);
        params.put("direction", direction);

        return Optional.of(new Pattern(PatternType.TREND, direction, fit.rSquared(),
                String.format("%s shows a %s trend (slope %.4f per point)", attribute, direction, fit.slope()),
                params));
    }

    /**
     * Finds the dominant period with a discrete Fourier transform over the detrended series.
     * Strength is the share of spectral power within one bin of the peak.
     */
    Optional<Pattern> detectSeasonality(String attribute, double[] series) {
        int n = series.length;
        double[] detrended = detrend(series);

        int maxBin = n / 2;
        if (maxBin < 2 || StatUtils.variance(detrended) < EPSILON) {
            return Optional.empty();
        }
        double[] power = new double[maxBin + 1];
        double total = 0.0;
        for (int k = 1; k <= maxBin; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int t = 0; t < n; t++) {
                double angle = 2 * Math.PI * k * t / n;
                re += detrended[t] * Math.cos(angle);
                im -= detrended[t] * Math.sin(angle);
            }
            power[k] = re * re + im * im;
            total += power[k];
        }
        if (total <= 0.0) {
            return Optional.empty();
        }

        int peak = 2;
        for (int k = 2; k <= maxBin; k++) {
            if (power[k] > power[peak]) {
                peak = k;
            }
        }

        double peakPower = 0.0;
        for (int k = Math.max(1, peak - 1); k <= Math.min(maxBin, peak + 1); k++) {
            peakPower += power[k];
        }
        double strength = peakPower / total;
        if (strength < SEASONALITY_MIN_STRENGTH) {
            return Optional.empty();
        }

        double period = (double) n / peak;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("period", period);
        params.put("frequency_bin", peak);
        params.put("strength", strength);

        return Optional.of(new Pattern(PatternType.SEASONAL, "periodic", strength,
                String.format("%s repeats every %.1f points (strength %.2f)", attribute, period, strength),
                params));
    }

    /**
     * Flags points more than three standard deviations from the mean of the preceding window.
     */
    Optional<Pattern> detectAnomalies(String attribute, double[] series) {
        int window = Math.max(MIN_SEGMENT, Math.min(24, series.length / 4));
        List<Integer> indices = new ArrayList<>();
        List<Double> scores = new ArrayList<>();

        for (int i = window; i < series.length; i++) {
            double[] baseline = Arrays.copyOfRange(series, i - window, i);
            double mean = StatUtils.mean(baseline);
            double sd = StatUtils.stdDev(baseline);
            if (sd == 0.0) {
                continue;
            }
            double z = (series[i] - mean) / sd;
            if (Math.abs(z) > ANOMALY_Z_THRESHOLD) {
                indices.add(i);
                scores.add(z);
            }
        }
        if (indices.isEmpty()) {
            return Optional.empty();
        }

        double flaggedShare = (double) indices.size() / (series.length - window);
        double confidence = flaggedShare > 0.05 ? 0.95 * 0.05 / flaggedShare : 0.95;

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("indices", indices);
        params.put("z_scores", scores);
        params.put("window", window);

        return Optional.of(new Pattern(PatternType.ANOMALY, "point", confidence,
                String.format("%s has %d anomalous points", attribute, indices.size()), params));
    }

    /**
     * Splits the detrended series where the variance ratio between the two segments is largest.
     */
    Optional<Pattern> detectChangePoint(String attribute, double[] series) {
        int n = series.length;
        double[] residuals = detrend(series);
        double[] sum = new double[n + 1];
        double[] sumSq = new double[n + 1];
        for (int i = 0; i < n; i++) {
            sum[i + 1] = sum[i] + residuals[i];
            sumSq[i + 1] = sumSq[i] + residuals[i] * residuals[i];
        }

        int best = -1;
        double bestRatio = 0.0;
        for (int split = MIN_SEGMENT; split <= n - MIN_SEGMENT; split++) {
            double before = segmentVariance(sum, sumSq, 0, split);
            double after = segmentVariance(sum, sumSq, split, n);
            double low = Math.min(before, after);
            double high = Math.max(before, after);
            double ratio = low < EPSILON ? (high < EPSILON ? 1.0 : Double.POSITIVE_INFINITY) : high / low;
            if (ratio > bestRatio) {
                bestRatio = ratio;
                best = split;
            }
        }
        if (best < 0 || bestRatio < CHANGE_POINT_VARIANCE_RATIO) {
            return Optional.empty();
        }

        double confidence = Double.isInfinite(bestRatio) ? 0.9 : Math.min(0.9, 0.5 + Math.log10(bestRatio) / 2);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("index", best);
        params.put("variance_ratio", Double.isInfinite(bestRatio) ? Double.MAX_VALUE : bestRatio);

        return Optional.of(new Pattern(PatternType.CHANGE_POINT, "variance_shift", confidence,
                String.format("%s changes variance at point %d", attribute, best), params));
    }

    private static double segmentVariance(double[] sum, double[] sumSq, int from, int to) {
        int count = to - from;
        double mean = (sum[to] - sum[from]) / count;
        return Math.max(0.0, (sumSq[to] - sumSq[from]) / count - mean * mean);
    }

    private static double[] detrend(double[] series) {
        StatUtils.LinearFit fit = StatUtils.linearRegression(series);
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            out[i] = series[i] - (fit.intercept() + fit.slope() * i);
        }
        return out;
    }
}
