package com.jobportal.application.jobs;

import com.jobportal.application.auth.Actor;
import com.jobportal.application.auth.CredentialStore;
import com.jobportal.application.guard.RoleGuard;
import com.jobportal.domain.error.ForbiddenException;
import com.jobportal.domain.error.NotFoundException;
import com.jobportal.domain.error.ValidationException;
import com.jobportal.domain.model.Identity;
import com.jobportal.domain.model.JobPosting;
import com.jobportal.domain.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Job postings keyed by a generated id, kept in insertion order.
 *
 * Mutations (id generation + insert, ownership check + update/delete) run under the
 * write lock, reads share the read lock.
 */
public final class JobCatalog {

    private static final Logger log = LoggerFactory.getLogger(JobCatalog.class);

    private final Map<Long, JobPosting> jobs = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long lastId;

    private final CredentialStore credentials;
    private final Clock clock;

    public JobCatalog(CredentialStore credentials, Clock clock) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public JobPosting create(Actor actor, JobFields fields) {
        RoleGuard.require(actor, Role.EMPLOYER, "Only employers can post jobs");
        Identity employer = credentials.require(actor);
        if (fields == null) {
            throw new ValidationException("Job fields are required");
        }
        requireText(fields.title(), "title");
        requireText(fields.description(), "description");
        requireText(fields.location(), "location");
        checkSkills(fields.skills());
        checkSalaryRange(fields.salaryMin(), fields.salaryMax());

        String company = employer.companyName() != null ? employer.companyName() : trimToNull(fields.company());

        JobPosting created;
        lock.writeLock().lock();
        try {
            long id = ++lastId;
            created = new JobPosting(
                    id,
                    employer.id(),
                    fields.title().trim(),
                    fields.description().trim(),
                    company,
                    fields.location().trim(),
                    fields.skills(),
                    fields.salaryMin(),
                    fields.salaryMax(),
                    clock.instant()
            );
            jobs.put(id, created);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("[JOBS] created jobId={} employerId={}", created.id(), created.employerId());
        return created;
    }

    public List<JobPosting> list(JobFilter filter) {
        JobFilter f = filter == null ? JobFilter.none() : filter;
        return snapshot().stream()
                .filter(f::matches)
                .collect(Collectors.toList());
    }

    /**
     * @throws NotFoundException if no posting has this id
     */
    public JobPosting get(long jobId) {
        return find(jobId).orElseThrow(() -> new NotFoundException("Job not found"));
    }

    public Optional<JobPosting> find(long jobId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(jobId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<JobPosting> listByEmployer(UUID employerId) {
        return snapshot().stream()
                .filter(j -> j.isOwnedBy(employerId))
                .collect(Collectors.toList());
    }

    /**
     * Applies the non-null fields to the posting.
     *
     * @throws NotFoundException if the posting is missing
     * @throws ForbiddenException if the actor did not post it
     */
    public JobPosting update(long jobId, Actor actor, JobFields fields) {
        Objects.requireNonNull(actor, "actor");
        JobFields changes = fields == null ? new JobFields(null, null, null, null, null, null, null) : fields;
        rejectBlank(changes.title(), "title");
        rejectBlank(changes.description(), "description");
        rejectBlank(changes.location(), "location");
        checkSkills(changes.skills());

        JobPosting updated;
        lock.writeLock().lock();
        try {
            JobPosting current = requireOwned(jobId, actor, "Cannot update job not posted by you");
            updated = new JobPosting(
                    current.id(),
                    current.employerId(),
                    changes.title() != null ? changes.title().trim() : current.title(),
                    changes.description() != null ? changes.description().trim() : current.description(),
                    changes.company() != null ? trimToNull(changes.company()) : current.company(),
                    changes.location() != null ? changes.location().trim() : current.location(),
                    changes.skills() != null ? changes.skills() : current.skills(),
                    changes.salaryMin() != null ? changes.salaryMin() : current.salaryMin(),
                    changes.salaryMax() != null ? changes.salaryMax() : current.salaryMax(),
                    current.createdAt()
            );
            checkSalaryRange(updated.salaryMin(), updated.salaryMax());
            jobs.put(jobId, updated);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("[JOBS] updated jobId={} by={}", jobId, actor.identityId());
        return updated;
    }

    /**
     * Removes the posting. Applications referring to it are left in place.
     *
     * @throws NotFoundException if the posting is missing
     * @throws ForbiddenException if the actor did not post it
     */
    public void delete(long jobId, Actor actor) {
        Objects.requireNonNull(actor, "actor");
        lock.writeLock().lock();
        try {
            requireOwned(jobId, actor, "Cannot delete job not posted by you");
            jobs.remove(jobId);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[JOBS] deleted jobId={} by={}", jobId, actor.identityId());
    }

    // caller holds the write lock
    private JobPosting requireOwned(long jobId, Actor actor, String forbiddenMessage) {
        JobPosting current = jobs.get(jobId);
        if (current == null) {
            throw new NotFoundException("Job not found");
        }
        if (!current.isOwnedBy(actor.identityId())) {
            throw new ForbiddenException(forbiddenMessage);
        }
        return current;
    }

    private List<JobPosting> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(jobs.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static void rejectBlank(String value, String field) {
        if (value != null && value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
    }

    private static void checkSkills(List<String> skills) {
        if (skills != null && skills.stream().anyMatch(s -> s == null || s.isBlank())) {
            throw new ValidationException("skills must not contain blank entries");
        }
    }

    private static void checkSalaryRange(Integer min, Integer max) {
        if ((min != null && min < 0) || (max != null && max < 0)) {
            throw new ValidationException("Salary must not be negative");
        }
        if (min != null && max != null && min > max) {
            throw new ValidationException("salary_min must not exceed salary_max");
        }
    }

    private static String trimToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
