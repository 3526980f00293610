package com.telemetryrollup.core.stats;

import java.util.Collection;
import java.util.Objects;

/**
 * Stateless numeric primitives used by the aggregator and the anomaly
 * detector.
 *
 * <p>
 * Standard deviation is the <strong>population</strong> form (divisor
 * {@code n}), never the sample form.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatMath {

    /** Default z-score threshold, in standard deviations. */
    public static final double DEFAULT_Z_THRESHOLD = 2.0;

    private StatMath() {
        // utility class, not instantiable
    }

    /**
     * Arithmetic mean.
     *
     * <p>
     * The result is clamped to the observed range, so {@code min <= mean <= max}
     * holds even where floating-point rounding of the sum would drift outside it.
     * </p>
     *
     * @param values the series; must not be {@code null}
     * @return the mean
     * @throws EmptyInputException if {@code values} is empty
     */
    public static double mean(Collection<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new EmptyInputException("mean");
        }
        double sum = 0;
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        double mean = sum / values.size();
        return Math.max(lo, Math.min(hi, mean));
    }

    /**
     * @throws EmptyInputException if {@code values} is empty
     */
    public static double min(Collection<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new EmptyInputException("min");
        }
        double lo = Double.POSITIVE_INFINITY;
        for (double v : values) {
            lo = Math.min(lo, v);
        }
        return lo;
    }

    /**
     * @throws EmptyInputException if {@code values} is empty
     */
    public static double max(Collection<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new EmptyInputException("max");
        }
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            hi = Math.max(hi, v);
        }
        return hi;
    }

    /**
     * Population standard deviation, {@code sqrt(sum((x - mean)^2) / n)}.
     *
     * @param values the series; must not be {@code null}
     * @return the deviation; 0 for fewer than two values or a constant series
     */
    public static double populationStdDev(Collection<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.size() < 2 || isConstant(values)) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }

    /**
     * Count outliers with the {@linkplain #DEFAULT_Z_THRESHOLD default threshold}.
     *
     * @see #zScoreOutliers(Collection, double)
     */
    public static int zScoreOutliers(Collection<Double> values) {
        return zScoreOutliers(values, DEFAULT_Z_THRESHOLD);
    }

    /**
     * Count values whose absolute deviation from the mean is strictly greater
     * than {@code threshold × σ}.
     *
     * @param values    the series; must not be {@code null}
     * @param threshold number of standard deviations; must be &gt; 0
     * @return number of flagged values; 0 when σ is 0
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public static int zScoreOutliers(Collection<Double> values, double threshold) {
        Objects.requireNonNull(values, "values must not be null");
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        double std = populationStdDev(values);
        if (std == 0) {
            return 0;
        }
        double mean = mean(values);
        double allowedDeviation = threshold * std;
        int flagged = 0;
        for (double v : values) {
            if (Math.abs(v - mean) > allowedDeviation) {
                flagged++;
            }
        }
        return flagged;
    }

    private static boolean isConstant(Collection<Double> values) {
        Double first = null;
        for (Double v : values) {
            if (first == null) {
                first = v;
            } else if (Double.compare(first, v) != 0) {
                return false;
            }
        }
        return true;
    }
}
