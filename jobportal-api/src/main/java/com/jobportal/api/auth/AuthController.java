package com.jobportal.api.auth;

import com.jobportal.api.security.SecurityActor;
import com.jobportal.application.auth.CredentialStore;
import com.jobportal.application.auth.Registration;
import com.jobportal.application.auth.UserSummary;
import com.jobportal.domain.error.UnauthorizedException;
import com.jobportal.domain.model.Identity;
import com.jobportal.domain.model.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
public class AuthController {

  private final CredentialStore credentials;
  private final TokenService tokens;

  public AuthController(CredentialStore credentials, TokenService tokens) {
    this.credentials = credentials;
    this.tokens = tokens;
  }

  public record JobSeekerRegisterRequest(
      @Email @NotBlank String email,
      @NotBlank @Size(min = 6, max = 72) String password,
      @NotBlank String name,
      String resume
  ) {}

  public record EmployerRegisterRequest(
      @Email @NotBlank String email,
      @NotBlank @Size(min = 6, max = 72) String password,
      @NotBlank String name,
      @NotBlank String companyName
  ) {}

  /**
   * role is optional; when present the account must hold it.
   */
  public record LoginRequest(
      @Email @NotBlank String email,
      @NotBlank String password,
      Role role
  ) {}

  public record TokenResponse(
      String accessToken,
      String tokenType,
      long expiresIn
  ) {}

  @PostMapping(value = "/register/jobseeker", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<UserSummary> registerJobSeeker(@Valid @RequestBody JobSeekerRegisterRequest req) {
    Identity identity = credentials.register(new Registration(
        Role.JOBSEEKER, req.email(), req.password(), req.name(), null, req.resume()));
    return ResponseEntity.status(HttpStatus.CREATED).body(UserSummary.from(identity));
  }

  @PostMapping(value = "/register/employer", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<UserSummary> registerEmployer(@Valid @RequestBody EmployerRegisterRequest req) {
    Identity identity = credentials.register(new Registration(
        Role.EMPLOYER, req.email(), req.password(), req.name(), req.companyName(), null));
    return ResponseEntity.status(HttpStatus.CREATED).body(UserSummary.from(identity));
  }

  @PostMapping(value = "/login", produces = MediaType.APPLICATION_JSON_VALUE)
  public TokenResponse login(@Valid @RequestBody LoginRequest req) {
    Identity identity = credentials.authenticate(req.email(), req.password(), req.role());
    return toResponse(tokens.issue(identity));
  }

  /**
   * OAuth2 password-grant style login (form encoded). The first scope, if any, is the expected role.
   */
  @PostMapping(
      value = "/token",
      consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public TokenResponse token(
      @RequestParam("username") String username,
      @RequestParam("password") String password,
      @RequestParam(value = "scope", required = false) String scope
  ) {
    Identity identity = credentials.authenticate(username, password, roleFromScope(scope));
    return toResponse(tokens.issue(identity));
  }

  @GetMapping("/me")
  public UserSummary me() {
    return UserSummary.from(credentials.require(SecurityActor.current()));
  }

  private static Role roleFromScope(String scope) {
    if (scope == null || scope.isBlank()) return null;
    String first = scope.trim().split("\\s+")[0];
    try {
      return Role.fromString(first);
    } catch (IllegalArgumentException e) {
      throw new UnauthorizedException("Incorrect email, password, or role");
    }
  }

  private static TokenResponse toResponse(TokenService.IssuedToken t) {
    return new TokenResponse(t.value(), "bearer", t.expiresInSeconds());
  }
}
