package com.jobportal.application.ports;

/**
 * One-way password hashing. Implemented by the API module on top of Spring Security.
 */
public interface PasswordHasher {

    String hash(String rawPassword);

    boolean matches(String rawPassword, String hash);
}
