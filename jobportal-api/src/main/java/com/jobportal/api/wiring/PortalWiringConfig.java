package com.jobportal.api.wiring;

import com.jobportal.api.security.BcryptPasswordHasher;
import com.jobportal.application.applications.ApplicationLedger;
import com.jobportal.application.auth.CredentialStore;
import com.jobportal.application.dashboard.DashboardAggregator;
import com.jobportal.application.jobs.JobCatalog;
import com.jobportal.application.ports.PasswordHasher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Process-scoped stores. All state lives in these beans and is lost on restart.
 */
@Configuration
public class PortalWiringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordHasher passwordHasher(PasswordEncoder passwordEncoder) {
        return new BcryptPasswordHasher(passwordEncoder);
    }

    @Bean
    public CredentialStore credentialStore(PasswordHasher passwordHasher, Clock clock) {
        return new CredentialStore(passwordHasher, clock);
    }

    @Bean
    public JobCatalog jobCatalog(CredentialStore credentials, Clock clock) {
        return new JobCatalog(credentials, clock);
    }

    @Bean
    public ApplicationLedger applicationLedger(JobCatalog jobs, CredentialStore credentials, Clock clock) {
        return new ApplicationLedger(jobs, credentials, clock);
    }

    @Bean
    public DashboardAggregator dashboardAggregator(
            CredentialStore credentials,
            JobCatalog jobs,
            ApplicationLedger applications
    ) {
        return new DashboardAggregator(credentials, jobs, applications);
    }
}
