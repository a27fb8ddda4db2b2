package com.opsforge.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the Holt linear forecaster and its batch summary.
 *
 * @since 1.0.0
 */
public class ForecastSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Level smoothing constant, in (0, 1]. */
    private double alpha = 0.4;
    /** Trend smoothing constant, in (0, 1]. */
    private double beta = 0.2;
    private int horizon = 12;
    /** Series with fewer observations are left out of the summary. */
    private int minPoints = 5;
    /** Number of forecast steps reported per series. */
    private int displayCap = 8;
    private int topAnomalies = 5;

    /**
     * @throws IllegalStateException if a smoothing constant is outside (0, 1]
     *                               or a count is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (Double.isNaN(alpha) || alpha <= 0 || alpha > 1) {
            errors.add("alpha must be in (0, 1], got: " + alpha);
        }
        if (Double.isNaN(beta) || beta <= 0 || beta > 1) {
            errors.add("beta must be in (0, 1], got: " + beta);
        }
        if (horizon < 0) {
            errors.add("horizon must be >= 0, got: " + horizon);
        }
        if (minPoints < 1) {
            errors.add("minPoints must be >= 1, got: " + minPoints);
        }
        if (displayCap < 0) {
            errors.add("displayCap must be >= 0, got: " + displayCap);
        }
        if (topAnomalies < 0) {
            errors.add("topAnomalies must be >= 0, got: " + topAnomalies);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid forecast settings: " + String.join("; ", errors));
        }
    }

    /**
     * @return an independent copy, so later setter calls on this instance do
     *         not reach components built from the copy
     */
    public ForecastSettings copy() {
        ForecastSettings copy = new ForecastSettings();
        copy.alpha = alpha;
        copy.beta = beta;
        copy.horizon = horizon;
        copy.minPoints = minPoints;
        copy.displayCap = displayCap;
        copy.topAnomalies = topAnomalies;
        return copy;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public double getBeta() {
        return beta;
    }

    public void setBeta(double beta) {
        this.beta = beta;
    }

    public int getHorizon() {
        return horizon;
    }

    public void setHorizon(int horizon) {
        this.horizon = horizon;
    }

    public int getMinPoints() {
        return minPoints;
    }

    public void setMinPoints(int minPoints) {
        this.minPoints = minPoints;
    }

    public int getDisplayCap() {
        return displayCap;
    }

    public void setDisplayCap(int displayCap) {
        this.displayCap = displayCap;
    }

    public int getTopAnomalies() {
        return topAnomalies;
    }

    public void setTopAnomalies(int topAnomalies) {
        this.topAnomalies = topAnomalies;
    }

    @Override
    public String toString() {
        return "ForecastSettings{alpha=" + alpha + ", beta=" + beta + ", horizon=" + horizon
                + ", minPoints=" + minPoints + ", displayCap=" + displayCap
                + ", topAnomalies=" + topAnomalies + '}';
    }
}
