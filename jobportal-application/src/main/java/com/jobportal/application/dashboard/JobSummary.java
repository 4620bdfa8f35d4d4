package com.jobportal.application.dashboard;

import com.jobportal.domain.model.JobPosting;

public record JobSummary(long id, String title, String company, String location) {

    public static JobSummary from(JobPosting job) {
        return new JobSummary(job.id(), job.title(), job.company(), job.location());
    }
}
