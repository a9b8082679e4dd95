package com.metricsentinel.core.error;

/**
 * Thrown when analysis settings are missing or out of range.
 *
 * <p>
 * Raised while loading or validating configuration so that a misconfigured
 * job fails before it is ever scheduled.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
