package com.jobportal.api.applications;

import com.jobportal.api.security.SecurityActor;
import com.jobportal.application.applications.ApplicationLedger;
import com.jobportal.application.auth.Actor;
import com.jobportal.domain.error.ForbiddenException;
import com.jobportal.domain.model.ApplicationStatus;
import com.jobportal.domain.model.JobApplication;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/applications")
public class ApplicationController {

    private final ApplicationLedger applications;

    public ApplicationController(ApplicationLedger applications) {
        this.applications = applications;
    }

    /**
     * seekerEmail is optional; older clients send it and it must then match the token.
     */
    public record ApplyRequest(
            @NotNull Long jobId,
            String seekerEmail,
            String coverLetter
    ) {}

    public record ReviewRequest(
            @NotNull ApplicationStatus status
    ) {}

    @PostMapping({"", "/"})
    public ResponseEntity<JobApplication> apply(@Valid @RequestBody ApplyRequest req) {
        Actor actor = SecurityActor.current();
        if (req.seekerEmail() != null && !req.seekerEmail().trim().equalsIgnoreCase(actor.email())) {
            throw new ForbiddenException("You can only apply as yourself");
        }
        JobApplication created = applications.apply(actor, req.jobId(), req.coverLetter());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/my")
    public List<JobApplication> mine() {
        return applications.listByApplicant(SecurityActor.current().identityId());
    }

    @GetMapping("/for-job/{jobId}")
    public List<JobApplication> forJob(@PathVariable("jobId") long jobId) {
        return applications.listByJob(jobId, SecurityActor.current());
    }

    @PutMapping("/{appId}/review")
    public JobApplication review(@PathVariable("appId") long appId, @Valid @RequestBody ReviewRequest req) {
        return applications.review(appId, SecurityActor.current(), req.status());
    }
}
