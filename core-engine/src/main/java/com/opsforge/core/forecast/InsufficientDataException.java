package com.opsforge.core.forecast;

/**
 * Skip signal: a series has too few observations to forecast.
 *
 * <p>
 * Used inside the batch forecaster to decide whether a series qualifies. It
 * never reaches callers; a skipped series is simply absent from the summary.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(String series, int available, int required) {
        super("Series " + series + " has " + available + " point(s), " + required + " required");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
