package com.jobportal.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record JobPosting(
        long id,
        UUID employerId,
        String title,
        String description,
        String company,
        String location,
        List<String> skills,
        Integer salaryMin,
        Integer salaryMax,
        Instant createdAt
) {
    public JobPosting {
        Objects.requireNonNull(employerId, "employerId");
        Objects.requireNonNull(createdAt, "createdAt");
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public boolean isOwnedBy(UUID identityId) {
        return employerId.equals(identityId);
    }
}
