package com.jobportal.domain.error;

/**
 * Base class for request-terminal failures raised by the portal services.
 *
 * The API layer maps each subclass to one HTTP status and renders {@link #reason()}
 * as the stable error code.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    public abstract String reason();
}
