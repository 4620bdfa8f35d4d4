package com.jobportal.api.jobs;

import com.jobportal.api.jobs.dto.JobRequest;
import com.jobportal.api.jobs.dto.JobUpdateRequest;
import com.jobportal.api.security.SecurityActor;
import com.jobportal.application.jobs.JobCatalog;
import com.jobportal.application.jobs.JobFilter;
import com.jobportal.domain.model.JobPosting;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobCatalog jobs;

    public JobController(JobCatalog jobs) {
        this.jobs = jobs;
    }

    /**
     * Public search. skills may repeat (?skills=go&skills=sql) or be comma separated.
     */
    @GetMapping({"", "/"})
    public List<JobPosting> list(
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "location", required = false) String location,
            @RequestParam(value = "skills", required = false) List<String> skills
    ) {
        return jobs.list(new JobFilter(query, location, skills));
    }

    @PostMapping({"", "/"})
    public ResponseEntity<JobPosting> create(@Valid @RequestBody JobRequest req) {
        JobPosting created = jobs.create(SecurityActor.current(), req.toFields());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{jobId}")
    public JobPosting get(@PathVariable("jobId") long jobId) {
        return jobs.get(jobId);
    }

    @PutMapping("/{jobId}")
    public JobPosting update(@PathVariable("jobId") long jobId, @Valid @RequestBody JobUpdateRequest req) {
        return jobs.update(jobId, SecurityActor.current(), req.toFields());
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> delete(@PathVariable("jobId") long jobId) {
        jobs.delete(jobId, SecurityActor.current());
        return ResponseEntity.noContent().build();
    }
}
