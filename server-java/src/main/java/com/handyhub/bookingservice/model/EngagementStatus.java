package com.handyhub.bookingservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle vocabulary of an engagement. The lower-case wire value is what clients
 * send and receive.
 */
public enum EngagementStatus {
    OPEN("open"),
    REQUESTED("requested"),
    ACCEPTED("accepted"),
    DECLINED("declined"),
    QUOTATION_CREATED("quotation_created"),
    QUOTATION_ACCEPTED("quotation_accepted"),
    QUOTATION_DECLINED_PENDING_VISITATION("quotation_declined_pending_visitation"),
    TERMINATED_AFTER_QUOTATION_DECLINE("terminated_after_quotation_decline"),
    COMPLETED_PENDING_PAYMENT("completed_pending_payment"),
    COMPLETED("completed"),
    SCHEDULED("scheduled"),
    RECURRING_ENDED("recurring_ended"),
    PROVIDER_ENDED_RECURRING("provider_ended_recurring"),
    REMATCH("rematch"),
    CANCELLED_BY_CLIENT("cancelled_by_client"),
    NEXT_CANCELLED_BY_PROVIDER("next_cancelled_by_provider");

    private static final Set<EngagementStatus> HOLDABLE =
            EnumSet.of(OPEN, REQUESTED, DECLINED, REMATCH, CANCELLED_BY_CLIENT);

    // no reminders and no further generation once an engagement reaches one of these
    private static final Set<EngagementStatus> STOPPED = EnumSet.of(
            TERMINATED_AFTER_QUOTATION_DECLINE,
            RECURRING_ENDED,
            PROVIDER_ENDED_RECURRING,
            CANCELLED_BY_CLIENT,
            NEXT_CANCELLED_BY_PROVIDER);

    private final String wireValue;

    EngagementStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isHoldable() {
        return HOLDABLE.contains(this);
    }

    public boolean isStopped() {
        return STOPPED.contains(this);
    }

    @JsonCreator
    public static EngagementStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (EngagementStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown engagement status: " + value);
    }
}
