package com.jobportal.application.jobs;

import java.util.List;

/**
 * Posting fields supplied by an employer. On update, null means "leave unchanged".
 */
public record JobFields(
        String title,
        String description,
        String company,
        String location,
        List<String> skills,
        Integer salaryMin,
        Integer salaryMax
) {}
