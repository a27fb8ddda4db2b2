package com.opsforge.core.forecast;

import com.opsforge.core.model.MalformedInputException;
import com.opsforge.core.stats.TimeseriesStats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Holt's linear trend method: double exponential smoothing without seasonality.
 *
 * <h3>Recurrence</h3>
 *
 * <pre>
 *   level_0 = x_0,   trend_0 = x_1 - x_0
 *   level_t = alpha * x_t + (1 - alpha) * (level_{t-1} + trend_{t-1})
 *   trend_t = beta * (level_t - level_{t-1}) + (1 - beta) * trend_{t-1}
 *   fitted_t = level_t + trend_t,   residual_t = x_t - fitted_t
 *   forecast_k = level_n + k * trend_n
 * </pre>
 *
 * <p>
 * The projection is a straight line, so curved trends will be under- or
 * over-shot. Cost is O(n + horizon).
 * </p>
 *
 * @since 1.0.0
 */
public final class HoltLinearModel {

    private HoltLinearModel() {
        // utility class, not instantiable
    }

    /**
     * Fit the smoother and project {@code horizon} steps ahead.
     *
     * @param series  ordered observations; must not be {@code null}
     * @param horizon number of future steps, {@code >= 0}
     * @param alpha   level smoothing constant in (0, 1]
     * @param beta    trend smoothing constant in (0, 1]
     * @return the fit
     * @throws MalformedInputException if a smoothing constant or the horizon is out of range
     */
    public static HoltLinearFit fit(double[] series, int horizon, double alpha, double beta) {
        Objects.requireNonNull(series, "Series must not be null");
        TimeseriesStats.requireSmoothingConstant(alpha, "alpha");
        TimeseriesStats.requireSmoothingConstant(beta, "beta");
        if (horizon < 0) {
            throw new MalformedInputException("horizon must be >= 0, got: " + horizon);
        }

        if (series.length == 0) {
            return new HoltLinearFit(0.0, 0.0, new double[0], new double[horizon], new double[0]);
        }
        if (series.length == 1) {
            double single = series[0];
            double[] forecast = new double[horizon];
            Arrays.fill(forecast, single);
            return new HoltLinearFit(single, 0.0, new double[] {single}, forecast, new double[] {0.0});
        }

        double level = series[0];
        double trend = series[1] - series[0];
        double[] fitted = new double[series.length];
        double[] residuals = new double[series.length];
        fitted[0] = level;
        residuals[0] = series[0] - level;

        for (int i = 1; i < series.length; i++) {
            double actual = series[i];
            double lastLevel = level;
            level = alpha * actual + (1 - alpha) * (level + trend);
            trend = beta * (level - lastLevel) + (1 - beta) * trend;

            fitted[i] = level + trend;
            residuals[i] = actual - fitted[i];
        }

        double[] forecast = new double[horizon];
        for (int k = 1; k <= horizon; k++) {
            forecast[k - 1] = level + k * trend;
        }
        return new HoltLinearFit(level, trend, fitted, forecast, residuals);
    }
}
