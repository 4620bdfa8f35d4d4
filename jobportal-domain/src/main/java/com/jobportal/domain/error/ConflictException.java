package com.jobportal.domain.error;

public final class ConflictException extends DomainException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "conflict";
    }
}
