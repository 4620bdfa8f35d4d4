package com.jobportal.api.security;

import com.jobportal.application.ports.PasswordHasher;
import org.springframework.security.crypto.password.PasswordEncoder;

public final class BcryptPasswordHasher implements PasswordHasher {

  private final PasswordEncoder encoder;

  public BcryptPasswordHasher(PasswordEncoder encoder) {
    this.encoder = encoder;
  }

  @Override
  public String hash(String rawPassword) {
    return encoder.encode(rawPassword);
  }

  @Override
  public boolean matches(String rawPassword, String hash) {
    return encoder.matches(rawPassword, hash);
  }
}
