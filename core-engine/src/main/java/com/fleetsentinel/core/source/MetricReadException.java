package com.fleetsentinel.core.source;

/**
 * A metric series could not be read from the backing store.
 *
 * @since 1.0.0
 */
public class MetricReadException extends Exception {

    private static final long serialVersionUID = 1L;

    public MetricReadException(String message) {
        super(message);
    }

    public MetricReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
