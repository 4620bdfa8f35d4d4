package com.jobportal.application.guard;

import com.jobportal.application.auth.Actor;
import com.jobportal.domain.error.ForbiddenException;
import com.jobportal.domain.error.UnauthorizedException;
import com.jobportal.domain.model.Role;

/**
 * Role checks shared by the portal services.
 *
 * The HTTP gate already rejects mismatched roles per route; services repeat the check so
 * they stay safe when called from anywhere else.
 */
public final class RoleGuard {

    private RoleGuard() {}

    /**
     * @throws UnauthorizedException if there is no actor
     * @throws ForbiddenException if the actor holds a different role
     */
    public static void require(Actor actor, Role required, String message) {
        if (actor == null) {
            throw new UnauthorizedException("Not authenticated");
        }
        if (actor.role() != required) {
            throw new ForbiddenException(message);
        }
    }
}
