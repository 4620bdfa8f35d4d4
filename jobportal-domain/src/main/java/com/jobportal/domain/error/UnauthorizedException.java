package com.jobportal.domain.error;

/**
 * Bad credentials or a missing/invalid/expired bearer token.
 */
public final class UnauthorizedException extends DomainException {

    private final String reason;

    public UnauthorizedException(String message) {
        this("unauthorized", message);
    }

    private UnauthorizedException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static UnauthorizedException invalidToken(String message) {
        return new UnauthorizedException("invalid_token", message);
    }

    @Override
    public String reason() {
        return reason;
    }
}
