package org.carball.discovery.analyzer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics and regression helpers over {@code double[]} series.
 */
public final class StatUtils {

    private StatUtils() {
    }

    public record LinearFit(double slope, double intercept, double rSquared, double slopeStdError) {

        /**
         * t statistic of the slope; infinite when the fit is exact.
         */
        public double slopeTStatistic() {
            if (slopeStdError == 0.0) {
                return slope == 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
            }
            return Math.abs(slope / slopeStdError);
        }
    }

    public static Double toDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        return null;
    }

    /**
     * Numeric values in order, skipping nulls and non-numbers.
     */
    public static double[] numericValues(List<Object> values) {
        List<Double> numbers = new ArrayList<>(values.size());
        for (Object value : values) {
            Double d = toDouble(value);
            if (d != null) {
                numbers.add(d);
            }
        }
        double[] result = new double[numbers.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = numbers.get(i);
        }
        return result;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / values.length;
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    /**
     * Linear-interpolated percentile of an already sorted array, {@code p} in [0, 100].
     */
    public static double percentile(double[] sortedValues, double p) {
        if (sortedValues.length == 0) {
            return 0.0;
        }
        double rank = p / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double weight = rank - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    public static double skewness(double[] values) {
        double sd = stdDev(values);
        if (values.length < 3 || sd == 0.0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow((v - mean) / sd, 3);
        }
        return sum / values.length;
    }

    public static double excessKurtosis(double[] values) {
        double sd = stdDev(values);
        if (values.length < 4 || sd == 0.0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow((v - mean) / sd, 4);
        }
        return sum / values.length - 3.0;
    }

    /**
     * Pearson correlation of two equally long series; 0 when either is constant.
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Series lengths differ: " + x.length + " vs " + y.length);
        }
        if (x.length < 2) {
            return 0.0;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double covariance = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0.0 || varY == 0.0) {
            return 0.0;
        }
        double r = covariance / Math.sqrt(varX * varY);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Two-sided p-value of a Pearson coefficient from its t statistic, using the normal
     * approximation of the t distribution.
     */
    public static double correlationPValue(double r, int n) {
        if (n < 3) {
            return 1.0;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1 - r * r));
        return Math.max(0.0, Math.min(1.0, erfc(t / Math.sqrt(2))));
    }

    /**
     * Complementary error function (Numerical Recipes erfcc, fractional error below 1.2e-7).
     */
    public static double erfc(double x) {
        double z = Math.abs(x);
        double t = 1.0 / (1.0 + 0.5 * z);
        double ans = t * Math.exp(-z * z - 1.26551223 + t * (1.00002368 + t * (0.37409196 + t * (0.09678418
                + t * (-0.18628806 + t * (0.27886807 + t * (-1.13520398 + t * (1.48851587
                + t * (-0.82215223 + t * 0.17087277)))))))));
        return x >= 0 ? ans : 2.0 - ans;
    }

    /**
     * Least-squares fit of {@code y} against its index.
     */
    public static LinearFit linearRegression(double[] y) {
        double[] x = new double[y.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
        }
        return linearRegression(x, y);
    }

    public static LinearFit linearRegression(double[] x, double[] y) {
        int n = x.length;
        if (n < 2) {
            return new LinearFit(0.0, n == 1 ? y[0] : 0.0, 0.0, 0.0);
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxx = 0.0;
        double sxy = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            sxx += (x[i] - meanX) * (x[i] - meanX);
            sxy += (x[i] - meanX) * (y[i] - meanY);
            syy += (y[i] - meanY) * (y[i] - meanY);
        }
        if (sxx == 0.0) {
            return new LinearFit(0.0, meanY, 0.0, 0.0);
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double rSquared = syy == 0.0 ? 0.0 : (sxy * sxy) / (sxx * syy);

        double residual = Math.max(0.0, syy - slope * sxy);
        double slopeStdError = n > 2 ? Math.sqrt(residual / (n - 2) / sxx) : 0.0;
        return new LinearFit(slope, intercept, rSquared, slopeStdError);
    }
}
