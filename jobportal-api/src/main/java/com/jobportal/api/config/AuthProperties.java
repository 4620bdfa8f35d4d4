package com.jobportal.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Access token settings.
 *
 * jwtSecret comes from JOBPORTAL_JWT_SECRET outside of the dev/test profiles.
 */
@ConfigurationProperties(prefix = "jobportal.auth")
public record AuthProperties(

    String jwtSecret,

    @DefaultValue("jobportal")
    String issuer,

    /**
     * Lifetime of issued access tokens.
     */
    @DefaultValue("60")
    long accessTokenMinutes

) {}
