package com.metricsentinel.core.error;

/**
 * Thrown when a computation is called with arguments it cannot accept
 * (mismatched array lengths, negative sensitivity, out-of-order points).
 *
 * <p>
 * The call is rejected before any computation happens. Ordinary
 * "not enough data" situations never raise this exception; they return a
 * defined default value instead.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
