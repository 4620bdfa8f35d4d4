package com.jobportal.application.auth;

import com.jobportal.domain.model.Role;

import java.util.Objects;
import java.util.UUID;

/**
 * Who is calling, as resolved from a verified bearer token.
 */
public record Actor(UUID identityId, String email, Role role) {
    public Actor {
        Objects.requireNonNull(identityId, "identityId");
        Objects.requireNonNull(role, "role");
    }
}
