package com.jobportal.application.auth;

import com.jobportal.application.ports.PasswordHasher;
import com.jobportal.domain.error.ConflictException;
import com.jobportal.domain.error.UnauthorizedException;
import com.jobportal.domain.error.ValidationException;
import com.jobportal.domain.model.Identity;
import com.jobportal.domain.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registered identities keyed by normalized email.
 *
 * Registration and lookups are guarded by one read/write lock; password hashing runs
 * outside of it.
 */
public final class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    static final int MIN_PASSWORD_LENGTH = 6;

    private final Map<String, Identity> byEmail = new HashMap<>();
    private final Map<UUID, Identity> byId = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final PasswordHasher hasher;
    private final Clock clock;

    public CredentialStore(PasswordHasher hasher, Clock clock) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws ConflictException if the email is already registered under any role
     * @throws ValidationException if a required field is missing
     */
    public Identity register(Registration registration) {
        validate(registration);

        String email = normalizeEmail(registration.email());
        String passwordHash = hasher.hash(registration.password());

        Identity identity = new Identity(
                UUID.randomUUID(),
                email,
                passwordHash,
                registration.role(),
                registration.name().trim(),
                trimToNull(registration.companyName()),
                trimToNull(registration.resume()),
                clock.instant()
        );

        lock.writeLock().lock();
        try {
            if (byEmail.containsKey(email)) {
                throw new ConflictException("Email already registered");
            }
            byEmail.put(email, identity);
            byId.put(identity.id(), identity);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("[AUTH] registered id={} role={}", identity.id(), identity.role());
        return identity;
    }

    /**
     * @param expectedRole optional; when present the identity must hold this role
     * @throws UnauthorizedException on unknown email, wrong password or role mismatch
     */
    public Identity authenticate(String email, String password, Role expectedRole) {
        String normalized = normalizeEmail(email);
        Identity identity = findByEmail(normalized).orElse(null);

        boolean ok = identity != null
                && password != null
                && hasher.matches(password, identity.passwordHash())
                && (expectedRole == null || identity.role() == expectedRole);

        if (!ok) {
            log.warn("[AUTH] login rejected email={}", normalized);
            throw new UnauthorizedException("Incorrect email, password, or role");
        }
        return identity;
    }

    /**
     * Resolves the identity behind a verified token.
     *
     * @throws UnauthorizedException if the identity is gone or its role differs from the token
     */
    public Identity require(Actor actor) {
        if (actor == null) {
            throw new UnauthorizedException("Not authenticated");
        }
        Identity identity = findById(actor.identityId())
                .orElseThrow(() -> new UnauthorizedException("Could not validate credentials"));
        if (identity.role() != actor.role()) {
            throw new UnauthorizedException("Could not validate credentials");
        }
        return identity;
    }

    public Optional<Identity> findById(UUID id) {
        if (id == null) return Optional.empty();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Identity> findByEmail(String email) {
        String normalized = normalizeEmail(email);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byEmail.get(normalized));
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void validate(Registration r) {
        if (r == null || r.role() == null) {
            throw new ValidationException("Role is required");
        }
        if (isBlank(r.email())) {
            throw new ValidationException("Email is required");
        }
        if (r.password() == null || r.password().length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (isBlank(r.name())) {
            throw new ValidationException("Name is required");
        }
        switch (r.role()) {
            case EMPLOYER -> {
                if (isBlank(r.companyName())) {
                    throw new ValidationException("Company name is required for employers");
                }
            }
            case JOBSEEKER -> {
                // resume is optional
            }
        }
    }

    static String normalizeEmail(String email) {
        if (email == null) return "";
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String trimToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
