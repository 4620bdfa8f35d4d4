package com.jobportal.application.jobs;

import com.jobportal.domain.model.JobPosting;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobFilterTest {

    private final JobPosting backend = job("Backend Engineer", "Build APIs in Go", "Remote", "Go", "SQL");
    private final JobPosting frontend = job("Frontend Developer", "React and CSS", "Berlin, DE", "react");

    @Test
    void noCriteriaMatchesEverything() {
        assertThat(JobFilter.none().matches(backend)).isTrue();
        assertThat(new JobFilter(" ", "", List.of(" ")).matches(frontend)).isTrue();
    }

    @Test
    void queryMatchesTitleOrDescriptionIgnoringCase() {
        assertThat(new JobFilter("backend", null, null).matches(backend)).isTrue();
        assertThat(new JobFilter("APIS", null, null).matches(backend)).isTrue();
        assertThat(new JobFilter("backend", null, null).matches(frontend)).isFalse();
    }

    @Test
    void locationIsCaseInsensitiveSubstring() {
        assertThat(new JobFilter(null, "remote", null).matches(backend)).isTrue();
        assertThat(new JobFilter(null, "berlin", null).matches(frontend)).isTrue();
        assertThat(new JobFilter(null, "berlin", null).matches(backend)).isFalse();
    }

    @Test
    void everyRequestedSkillMustBeListed() {
        assertThat(new JobFilter(null, null, List.of("go")).matches(backend)).isTrue();
        assertThat(new JobFilter(null, null, List.of("GO", "sql")).matches(backend)).isTrue();
        assertThat(new JobFilter(null, null, List.of("go", "rust")).matches(backend)).isFalse();
        assertThat(new JobFilter(null, null, List.of("go")).matches(frontend)).isFalse();
    }

    @Test
    void criteriaAreCombinedWithAnd() {
        assertThat(new JobFilter("engineer", "remote", List.of("go")).matches(backend)).isTrue();
        assertThat(new JobFilter("engineer", "berlin", List.of("go")).matches(backend)).isFalse();
    }

    private static JobPosting job(String title, String description, String location, String... skills) {
        return new JobPosting(1, UUID.randomUUID(), title, description, "Acme", location,
                List.of(skills), null, null, Instant.now());
    }
}
