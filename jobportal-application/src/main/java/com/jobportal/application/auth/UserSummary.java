package com.jobportal.application.auth;

import com.jobportal.domain.model.Identity;
import com.jobportal.domain.model.Role;

import java.util.UUID;

/**
 * Public view of an {@link Identity}; never carries the password hash.
 */
public record UserSummary(UUID id, String email, String name, Role role, String companyName) {

    public static UserSummary from(Identity identity) {
        return new UserSummary(
                identity.id(),
                identity.email(),
                identity.name(),
                identity.role(),
                identity.companyName()
        );
    }
}
