package com.telemetryrollup.core.stats;

/**
 * Thrown when a statistic that is undefined for an empty series is requested
 * on one.
 *
 * @since 1.0.0
 */
public class EmptyInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String statistic) {
        super("Cannot compute " + statistic + " of an empty series");
    }
}
