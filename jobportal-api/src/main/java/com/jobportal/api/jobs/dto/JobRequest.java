package com.jobportal.api.jobs.dto;

import com.jobportal.application.jobs.JobFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * New posting. company is ignored when the employer registered a company name.
 */
public record JobRequest(
        @NotBlank String title,
        @NotBlank String description,
        String company,
        @NotBlank String location,
        List<@NotBlank String> skills,
        @PositiveOrZero Integer salaryMin,
        @PositiveOrZero Integer salaryMax
) {
    public JobFields toFields() {
        return new JobFields(title, description, company, location, skills == null ? List.of() : skills, salaryMin, salaryMax);
    }
}
