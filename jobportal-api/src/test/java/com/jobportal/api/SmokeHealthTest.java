package com.jobportal.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class SmokeHealthTest {
  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;

  @Test void actuatorHealthIsUp() {
    var r = rest.getForEntity("http://localhost:" + port + "/actuator/health", String.class);
    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
  }

  @Test void rootReportsHealthy() {
    var r = rest.getForEntity("http://localhost:" + port + "/", Map.class);
    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
    assertThat(r.getBody()).containsEntry("message", "Healthy");
  }

  @Test void requestIdIsEchoed() {
    var headers = new HttpHeaders();
    headers.set("X-Request-Id", "smoke-123");
    var r = rest.exchange("http://localhost:" + port + "/", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);
    assertThat(r.getHeaders().getFirst("X-Request-Id")).isEqualTo("smoke-123");
  }
}
