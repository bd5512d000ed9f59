package com.handyhub.bookingservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Yes/no answer used by provider responses and quotation decisions.
 */
public enum ProviderDecision {
    ACCEPTED("accepted"),
    DECLINED("declined");

    private final String wireValue;

    ProviderDecision(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ProviderDecision fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (ProviderDecision decision : values()) {
            if (decision.wireValue.equals(normalized)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Decision must be 'accepted' or 'declined', got: " + value);
    }
}
