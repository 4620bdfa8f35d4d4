package com.jobportal.application.jobs;

import com.jobportal.domain.model.JobPosting;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Search criteria for {@link JobCatalog#list(JobFilter)}.
 *
 * Blank criteria are ignored; supplied criteria are AND-combined:
 * <ul>
 *   <li>query: case-insensitive substring of title or description</li>
 *   <li>location: case-insensitive substring of the posting location</li>
 *   <li>skills: every requested skill is listed on the posting (case-insensitive)</li>
 * </ul>
 */
public record JobFilter(String query, String location, List<String> skills) {

    public JobFilter {
        query = blankToNull(query);
        location = blankToNull(location);
        skills = skills == null ? List.of() : skills.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableList());
    }

    public static JobFilter none() {
        return new JobFilter(null, null, null);
    }

    public boolean matches(JobPosting job) {
        if (query != null) {
            String q = lower(query);
            if (!lower(job.title()).contains(q) && !lower(job.description()).contains(q)) {
                return false;
            }
        }
        if (location != null && !lower(job.location()).contains(lower(location))) {
            return false;
        }
        if (!skills.isEmpty()) {
            Set<String> offered = job.skills().stream()
                    .map(JobFilter::lower)
                    .collect(Collectors.toSet());
            for (String wanted : skills) {
                if (!offered.contains(lower(wanted))) return false;
            }
        }
        return true;
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
