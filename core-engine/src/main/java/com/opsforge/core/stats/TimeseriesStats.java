package com.opsforge.core.stats;

import com.opsforge.core.model.MalformedInputException;

/**
 * Numeric helpers shared by the forecaster and the learner.
 *
 * <p>
 * All variance figures are <strong>population</strong> statistics (divide by
 * {@code n}), matching the residual scoring the forecaster performs.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeseriesStats {

    private TimeseriesStats() {
        // utility class, not instantiable
    }

    /**
     * @return arithmetic mean, or {@code 0} for an empty array
     */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * @return population variance, or {@code 0} for an empty array
     */
    public static double populationVariance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / values.length;
    }

    public static double populationStdDev(double[] values) {
        return Math.sqrt(populationVariance(values));
    }

    /**
     * Z-score of {@code latest} against the spread of {@code history}.
     *
     * @param latest  the value to score
     * @param history reference values
     * @return {@code |latest - mean| / stddev}; {@code 0} when {@code history}
     *         is empty or has zero variance
     */
    public static double zScore(double latest, double[] history) {
        if (history.length == 0) {
            return 0.0;
        }
        double std = populationStdDev(history);
        if (std == 0.0) {
            return 0.0;
        }
        double z = Math.abs(latest - mean(history)) / std;
        return Double.isFinite(z) ? z : 0.0;
    }

    /**
     * Validate a smoothing constant for exponential smoothing.
     *
     * @param value the constant
     * @param name  parameter name used in the error message
     * @return {@code value}
     * @throws MalformedInputException if {@code value} is NaN or outside (0, 1]
     */
    public static double requireSmoothingConstant(double value, String name) {
        if (Double.isNaN(value) || value <= 0.0 || value > 1.0) {
            throw new MalformedInputException(name + " must be in (0, 1], got: " + value);
        }
        return value;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
