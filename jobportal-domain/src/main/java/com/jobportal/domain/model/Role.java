package com.jobportal.domain.model;

import java.util.Locale;

public enum Role {
    JOBSEEKER,
    EMPLOYER;

    /**
     * Lenient parse used for login role hints and token claims ("jobseeker", "EMPLOYER").
     *
     * @throws IllegalArgumentException if the value names no role
     */
    public static Role fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role is blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("_", "").replace("-", "");
        for (Role r : values()) {
            if (r.name().equals(normalized)) return r;
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
