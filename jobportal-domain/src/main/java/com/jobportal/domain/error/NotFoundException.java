package com.jobportal.domain.error;

public final class NotFoundException extends DomainException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "not_found";
    }
}
