package com.handyhub.bookingservice.security;

import com.handyhub.bookingservice.exception.ForbiddenException;
import com.handyhub.bookingservice.exception.UnauthorizedException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.Engagement;

import java.util.Arrays;

public final class CallerChecks {

    private CallerChecks() {
    }

    public static CallerIdentity requireCaller(CallerIdentity caller) {
        if (caller == null || caller.uid() == null || caller.uid().isBlank()) {
            throw new UnauthorizedException("Authentication required");
        }
        return caller;
    }

    public static CallerIdentity requireRole(CallerIdentity caller, CallerRole... allowed) {
        requireCaller(caller);
        if (Arrays.stream(allowed).noneMatch(caller::hasRole)) {
            throw new ForbiddenException("Role " + (caller.role() != null ? caller.role().name().toLowerCase() : "none")
                    + " may not perform this action");
        }
        return caller;
    }

    public static void requireOwner(CallerIdentity caller, Engagement engagement) {
        requireRole(caller, CallerRole.CLIENT);
        if (!engagement.isOwnedBy(caller.uid())) {
            throw new ForbiddenException("Engagement " + engagement.getId() + " belongs to another client");
        }
    }

    public static void requireAssignee(CallerIdentity caller, Engagement engagement) {
        requireRole(caller, CallerRole.PROVIDER);
        if (!engagement.isAssignedTo(caller.uid())) {
            throw new ForbiddenException("Engagement " + engagement.getId() + " is not assigned to you");
        }
    }

    public static boolean canRead(CallerIdentity caller, Engagement engagement) {
        return caller.hasRole(CallerRole.ADMIN)
                || engagement.isOwnedBy(caller.uid())
                || engagement.isAssignedTo(caller.uid());
    }
}
