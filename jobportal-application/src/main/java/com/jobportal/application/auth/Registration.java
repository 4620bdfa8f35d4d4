package com.jobportal.application.auth;

import com.jobportal.domain.model.Role;

/**
 * Registration input. companyName applies to employers, resume to job seekers.
 */
public record Registration(
        Role role,
        String email,
        String password,
        String name,
        String companyName,
        String resume
) {}
