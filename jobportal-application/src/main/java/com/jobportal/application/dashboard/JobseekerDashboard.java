package com.jobportal.application.dashboard;

import com.jobportal.application.auth.UserSummary;
import com.jobportal.domain.model.ApplicationStatus;
import com.jobportal.domain.model.JobPosting;

import java.time.Instant;
import java.util.List;

public record JobseekerDashboard(
        UserSummary user,
        int numApplications,
        List<AppliedJob> applications,
        List<JobPosting> appliedJobs
) {

    /**
     * One application with a summary of its job; job is null once the posting was deleted.
     */
    public record AppliedJob(
            long id,
            long jobId,
            ApplicationStatus status,
            String coverLetter,
            Instant appliedAt,
            JobSummary job
    ) {}
}
