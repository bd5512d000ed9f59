package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.ConflictException;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;

import java.util.Arrays;

final class TransitionGuard {

    private TransitionGuard() {
    }

    static void requireStatus(Engagement engagement, String action, EngagementStatus... allowed) {
        EngagementStatus current = engagement.getStatus();
        if (Arrays.stream(allowed).noneMatch(status -> status == current)) {
            throw ConflictException.invalidState(engagement.getId(), current, action);
        }
    }
}
