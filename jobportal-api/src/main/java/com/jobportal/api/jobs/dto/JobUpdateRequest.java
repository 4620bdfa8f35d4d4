package com.jobportal.api.jobs.dto;

import com.jobportal.application.jobs.JobFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Partial update: omitted (null) fields keep their current value.
 */
public record JobUpdateRequest(
        String title,
        String description,
        String company,
        String location,
        List<@NotBlank String> skills,
        @PositiveOrZero Integer salaryMin,
        @PositiveOrZero Integer salaryMax
) {
    public JobFields toFields() {
        return new JobFields(title, description, company, location, skills, salaryMin, salaryMax);
    }
}
