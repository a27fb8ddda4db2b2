package com.opsforge.core.forecast;

import java.util.Arrays;

/**
 * Result of fitting a Holt linear (level + trend) smoother to one series.
 *
 * <p>
 * Arrays are copied on the way in and on the way out, so instances are
 * effectively immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class HoltLinearFit {

    private final double level;
    private final double trend;
    private final double[] fitted;
    private final double[] forecast;
    private final double[] residuals;

    HoltLinearFit(double level, double trend, double[] fitted, double[] forecast, double[] residuals) {
        this.level = level;
        this.trend = trend;
        this.fitted = fitted.clone();
        this.forecast = forecast.clone();
        this.residuals = residuals.clone();
    }

    /**
     * @return final smoothed level
     */
    public double getLevel() {
        return level;
    }

    /**
     * @return final smoothed trend (change per step)
     */
    public double getTrend() {
        return trend;
    }

    /**
     * @return one fitted value per observation
     */
    public double[] getFitted() {
        return fitted.clone();
    }

    /**
     * @return {@code horizon} projected values; {@code forecast[k-1] = level + k * trend}
     */
    public double[] getForecast() {
        return forecast.clone();
    }

    /**
     * @return {@code actual - fitted} per observation
     */
    public double[] getResiduals() {
        return residuals.clone();
    }

    /**
     * @return the last residual, or {@code 0} when there are none
     */
    public double latestResidual() {
        return residuals.length == 0 ? 0.0 : residuals[residuals.length - 1];
    }

    @Override
    public String toString() {
        return "HoltLinearFit{level=" + level
                + ", trend=" + trend
                + ", forecast=" + Arrays.toString(forecast) + '}';
    }
}
