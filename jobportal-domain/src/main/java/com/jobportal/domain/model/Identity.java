package com.jobportal.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Registered portal user (no infrastructure concerns).
 *
 * companyName is set for employers, resume only (optionally) for job seekers.
 */
public record Identity(
        UUID id,
        String email,
        String passwordHash,
        Role role,
        String name,
        String companyName,
        String resume,
        Instant createdAt
) {
    public Identity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(passwordHash, "passwordHash");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
