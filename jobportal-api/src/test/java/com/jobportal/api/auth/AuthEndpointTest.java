package com.jobportal.api.auth;

import com.jobportal.api.ApiTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthEndpointTest extends ApiTestSupport {

  @Test
  void registerJobSeekerReturnsSummaryWithoutPassword() throws Exception {
    String email = uniqueEmail("ada");

    mvc.perform(withJson(post("/auth/register/jobseeker"),
            Map.of("email", email, "password", PASSWORD, "name", "Ada", "resume", "https://cv.example/ada")))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.email").value(email))
        .andExpect(jsonPath("$.name").value("Ada"))
        .andExpect(jsonPath("$.role").value("JOBSEEKER"))
        .andExpect(jsonPath("$.id").isNotEmpty())
        .andExpect(jsonPath("$.password").doesNotExist())
        .andExpect(jsonPath("$.password_hash").doesNotExist());
  }

  @Test
  void duplicateEmailIsConflictEvenForOtherRole() throws Exception {
    String email = uniqueEmail("dup");
    registerSeeker(email);

    mvc.perform(withJson(post("/auth/register/employer"),
            Map.of("email", email.toUpperCase(), "password", PASSWORD, "name", "X", "company_name", "Acme")))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("conflict"))
        .andExpect(jsonPath("$.request_id").isNotEmpty());
  }

  @Test
  void invalidRegistrationIsUnprocessable() throws Exception {
    mvc.perform(withJson(post("/auth/register/jobseeker"),
            Map.of("email", "not-an-email", "password", "123", "name", "Ada")))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.error").value("validation_error"))
        .andExpect(jsonPath("$.fields.email").exists())
        .andExpect(jsonPath("$.fields.password").exists());

    mvc.perform(withJson(post("/auth/register/employer"),
            Map.of("email", uniqueEmail("boss"), "password", PASSWORD, "name", "Boss")))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.fields.companyName").exists());
  }

  @Test
  void loginIssuesBearerToken() throws Exception {
    String email = uniqueEmail("login");
    registerEmployer(email, "Acme");

    mvc.perform(withJson(post("/auth/login"), Map.of("email", email, "password", PASSWORD)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.access_token").isNotEmpty())
        .andExpect(jsonPath("$.token_type").value("bearer"))
        .andExpect(jsonPath("$.expires_in").value(1800));
  }

  @Test
  void badCredentialsOrWrongRoleAreUnauthorized() throws Exception {
    String email = uniqueEmail("seeker");
    registerSeeker(email);

    mvc.perform(withJson(post("/auth/login"), Map.of("email", email, "password", "wrong-password")))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, startsWith("Bearer")))
        .andExpect(jsonPath("$.error").value("unauthorized"));

    mvc.perform(withJson(post("/auth/login"), Map.of("email", email, "password", PASSWORD, "role", "employer")))
        .andExpect(status().isUnauthorized());

    mvc.perform(withJson(post("/auth/login"), Map.of("email", uniqueEmail("ghost"), "password", PASSWORD)))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void formTokenEndpointTreatsScopeAsRole() throws Exception {
    String email = uniqueEmail("form");
    registerSeeker(email);

    mvc.perform(post("/auth/token")
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .param("username", email)
            .param("password", PASSWORD)
            .param("scope", "jobseeker"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.token_type").value("bearer"));

    mvc.perform(post("/auth/token")
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .param("username", email)
            .param("password", PASSWORD)
            .param("scope", "employer"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void meResolvesTheTokenIdentity() throws Exception {
    String email = uniqueEmail("me");
    String token = registerEmployer(email, "Acme");

    mvc.perform(bearer(get("/auth/me"), token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.email").value(email))
        .andExpect(jsonPath("$.role").value("EMPLOYER"))
        .andExpect(jsonPath("$.company_name").value("Acme"));

    mvc.perform(get("/auth/me"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"));

    mvc.perform(bearer(get("/auth/me"), "garbage.token.value"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_token"));
  }
}
