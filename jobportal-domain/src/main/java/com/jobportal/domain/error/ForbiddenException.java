package com.jobportal.domain.error;

public final class ForbiddenException extends DomainException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "forbidden";
    }
}
