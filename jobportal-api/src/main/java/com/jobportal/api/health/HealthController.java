package com.jobportal.api.health;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {
    @GetMapping("/")
    public Map<String, Object> health() {
        return Map.of(
                "message", "Healthy",
                "service", "jobportal-api",
                "ts", Instant.now().toString()
        );
    }
}
