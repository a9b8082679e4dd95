package com.metricsentinel.core.error;

/**
 * Failure reported by, or on behalf of, an external collaborator: a metrics
 * query that failed or timed out, or an alert dispatch that was rejected.
 *
 * <p>
 * Recoverable: the affected source is skipped and the run continues with the
 * remaining sources.
 * </p>
 *
 * @since 1.0.0
 */
public class CollaboratorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
