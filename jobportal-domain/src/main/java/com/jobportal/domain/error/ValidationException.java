package com.jobportal.domain.error;

public final class ValidationException extends DomainException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "validation_error";
    }
}
