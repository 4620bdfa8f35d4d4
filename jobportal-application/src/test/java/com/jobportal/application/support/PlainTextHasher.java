package com.jobportal.application.support;

import com.jobportal.application.ports.PasswordHasher;

/**
 * Reversible stand-in for BCrypt so store tests stay fast.
 */
public final class PlainTextHasher implements PasswordHasher {

    @Override
    public String hash(String rawPassword) {
        return "plain:" + rawPassword;
    }

    @Override
    public boolean matches(String rawPassword, String hash) {
        return hash.equals(hash(rawPassword));
    }
}
