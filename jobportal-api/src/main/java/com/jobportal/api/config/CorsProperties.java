package com.jobportal.api.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "jobportal.cors")
public record CorsProperties(

    @DefaultValue("*")
    List<String> allowedOrigins

) {}
