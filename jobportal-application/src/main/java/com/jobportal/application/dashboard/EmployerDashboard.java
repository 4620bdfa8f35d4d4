package com.jobportal.application.dashboard;

import com.jobportal.application.auth.UserSummary;
import com.jobportal.domain.model.ApplicationStatus;
import com.jobportal.domain.model.JobApplication;
import com.jobportal.domain.model.JobPosting;

import java.util.List;
import java.util.Map;

public record EmployerDashboard(
        UserSummary user,
        int numJobsPosted,
        int numApplications,
        List<PostingStats> jobs,
        List<JobApplication> applications
) {

    public record PostingStats(
            JobPosting job,
            long applicationCount,
            Map<ApplicationStatus, Long> statusBreakdown
    ) {}
}
