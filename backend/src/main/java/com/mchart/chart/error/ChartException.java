package com.mchart.chart.error;

/**
 * Root of the failures a chart lookup can surface to its caller.
 */
public abstract class ChartException extends RuntimeException {
    protected ChartException(String message) {
        super(message);
    }

    protected ChartException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code, used as the {@code error} field of API responses.
     */
    public abstract String errorCode();
}
