package com.jobportal.application.applications;

import com.jobportal.application.auth.Actor;
import com.jobportal.application.auth.CredentialStore;
import com.jobportal.application.guard.RoleGuard;
import com.jobportal.application.jobs.JobCatalog;
import com.jobportal.domain.error.ConflictException;
import com.jobportal.domain.error.ForbiddenException;
import com.jobportal.domain.error.NotFoundException;
import com.jobportal.domain.error.ValidationException;
import com.jobportal.domain.model.ApplicationStatus;
import com.jobportal.domain.model.JobApplication;
import com.jobportal.domain.model.JobPosting;
import com.jobportal.domain.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Job applications keyed by a generated id, kept in insertion order.
 *
 * A seeker may hold at most one application per job; the duplicate check and the insert
 * share one write-lock section. Lock order is ledger, then catalog; the catalog never
 * calls back into the ledger.
 */
public final class ApplicationLedger {

    private static final Logger log = LoggerFactory.getLogger(ApplicationLedger.class);

    private final Map<Long, JobApplication> applications = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long lastId;

    private final JobCatalog jobs;
    private final CredentialStore credentials;
    private final Clock clock;

    public ApplicationLedger(JobCatalog jobs, CredentialStore credentials, Clock clock) {
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws ForbiddenException if the actor is not a job seeker
     * @throws NotFoundException if the job does not exist
     * @throws ConflictException if the actor already applied to this job
     */
    public JobApplication apply(Actor actor, long jobId, String coverLetter) {
        RoleGuard.require(actor, Role.JOBSEEKER, "Only job seekers can apply");
        credentials.require(actor);
        jobs.get(jobId);

        JobApplication created;
        lock.writeLock().lock();
        try {
            boolean duplicate = applications.values().stream()
                    .anyMatch(a -> a.jobId() == jobId && a.applicantId().equals(actor.identityId()));
            if (duplicate) {
                throw new ConflictException("Already applied to this job");
            }
            long id = ++lastId;
            created = new JobApplication(
                    id,
                    jobId,
                    actor.identityId(),
                    (coverLetter == null || coverLetter.isBlank()) ? null : coverLetter.trim(),
                    ApplicationStatus.SUBMITTED,
                    clock.instant()
            );
            applications.put(id, created);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("[APPLICATIONS] submitted appId={} jobId={} applicantId={}", created.id(), jobId, actor.identityId());
        return created;
    }

    public List<JobApplication> listByApplicant(UUID applicantId) {
        return snapshot().stream()
                .filter(a -> a.applicantId().equals(applicantId))
                .collect(Collectors.toList());
    }

    /**
     * @throws NotFoundException if the job does not exist
     * @throws ForbiddenException unless the actor posted the job
     */
    public List<JobApplication> listByJob(long jobId, Actor actor) {
        Objects.requireNonNull(actor, "actor");
        JobPosting job = jobs.get(jobId);
        if (!job.isOwnedBy(actor.identityId())) {
            throw new ForbiddenException("Only the employer who posted the job can review applications");
        }
        return snapshot().stream()
                .filter(a -> a.jobId() == jobId)
                .collect(Collectors.toList());
    }

    public List<JobApplication> listByJobs(Collection<Long> jobIds) {
        Set<Long> wanted = Set.copyOf(jobIds);
        return snapshot().stream()
                .filter(a -> wanted.contains(a.jobId()))
                .collect(Collectors.toList());
    }

    public Optional<JobApplication> find(long appId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(applications.get(appId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets the status unconditionally.
     *
     * @throws NotFoundException if the application does not exist
     * @throws ForbiddenException unless the actor posted the referenced job
     */
    public JobApplication review(long appId, Actor actor, ApplicationStatus newStatus) {
        Objects.requireNonNull(actor, "actor");
        if (newStatus == null) {
            throw new ValidationException("status is required");
        }

        JobApplication updated;
        ApplicationStatus previous;
        lock.writeLock().lock();
        try {
            JobApplication current = applications.get(appId);
            if (current == null) {
                throw new NotFoundException("Application not found");
            }
            boolean owner = jobs.find(current.jobId())
                    .map(j -> j.isOwnedBy(actor.identityId()))
                    .orElse(false);
            if (!owner) {
                throw new ForbiddenException("Can only review applications for your jobs");
            }
            previous = current.status();
            updated = current.withStatus(newStatus);
            applications.put(appId, updated);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("[APPLICATIONS] reviewed appId={} {} -> {}", appId, previous, newStatus);
        return updated;
    }

    private List<JobApplication> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(applications.values());
        } finally {
            lock.readLock().unlock();
        }
    }
}
