package com.jobportal.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record JobApplication(
        long id,
        long jobId,
        UUID applicantId,
        String coverLetter,
        ApplicationStatus status,
        Instant appliedAt
) {
    public JobApplication {
        Objects.requireNonNull(applicantId, "applicantId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(appliedAt, "appliedAt");
    }

    public JobApplication withStatus(ApplicationStatus newStatus) {
        return new JobApplication(id, jobId, applicantId, coverLetter, newStatus, appliedAt);
    }
}
