package com.jobportal.application.dashboard;

import com.jobportal.application.applications.ApplicationLedger;
import com.jobportal.application.auth.Actor;
import com.jobportal.application.auth.CredentialStore;
import com.jobportal.application.auth.UserSummary;
import com.jobportal.application.guard.RoleGuard;
import com.jobportal.application.jobs.JobCatalog;
import com.jobportal.domain.model.ApplicationStatus;
import com.jobportal.domain.model.Identity;
import com.jobportal.domain.model.JobApplication;
import com.jobportal.domain.model.JobPosting;
import com.jobportal.domain.model.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only views over the catalog and the ledger for the calling identity.
 */
public final class DashboardAggregator {

    private final CredentialStore credentials;
    private final JobCatalog jobs;
    private final ApplicationLedger applications;

    public DashboardAggregator(CredentialStore credentials, JobCatalog jobs, ApplicationLedger applications) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.applications = Objects.requireNonNull(applications, "applications");
    }

    public JobseekerDashboard jobseekerDashboard(Actor actor) {
        RoleGuard.require(actor, Role.JOBSEEKER, "Job seekers only");
        Identity seeker = credentials.require(actor);

        List<JobApplication> mine = applications.listByApplicant(seeker.id());
        List<JobseekerDashboard.AppliedJob> entries = new ArrayList<>(mine.size());
        List<JobPosting> appliedJobs = new ArrayList<>();

        for (JobApplication a : mine) {
            Optional<JobPosting> job = jobs.find(a.jobId());
            job.ifPresent(appliedJobs::add);
            entries.add(new JobseekerDashboard.AppliedJob(
                    a.id(),
                    a.jobId(),
                    a.status(),
                    a.coverLetter(),
                    a.appliedAt(),
                    job.map(JobSummary::from).orElse(null)
            ));
        }

        return new JobseekerDashboard(UserSummary.from(seeker), mine.size(), entries, appliedJobs);
    }

    public EmployerDashboard employerDashboard(Actor actor) {
        RoleGuard.require(actor, Role.EMPLOYER, "Employers only");
        Identity employer = credentials.require(actor);

        List<JobPosting> posted = jobs.listByEmployer(employer.id());
        List<JobApplication> received = applications.listByJobs(
                posted.stream().map(JobPosting::id).collect(Collectors.toList()));

        Map<Long, List<JobApplication>> byJob = received.stream()
                .collect(Collectors.groupingBy(JobApplication::jobId));

        List<EmployerDashboard.PostingStats> stats = new ArrayList<>(posted.size());
        for (JobPosting job : posted) {
            List<JobApplication> forJob = byJob.getOrDefault(job.id(), List.of());
            stats.add(new EmployerDashboard.PostingStats(job, forJob.size(), breakdown(forJob)));
        }

        return new EmployerDashboard(
                UserSummary.from(employer),
                posted.size(),
                received.size(),
                stats,
                received
        );
    }

    private static Map<ApplicationStatus, Long> breakdown(List<JobApplication> apps) {
        Map<ApplicationStatus, Long> counts = new EnumMap<>(ApplicationStatus.class);
        for (ApplicationStatus s : ApplicationStatus.values()) {
            counts.put(s, 0L);
        }
        for (JobApplication a : apps) {
            counts.merge(a.status(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
