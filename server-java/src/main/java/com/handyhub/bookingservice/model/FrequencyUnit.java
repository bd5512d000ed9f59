package com.handyhub.bookingservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FrequencyUnit {
    WEEK("week"),
    MONTH("month");

    private final String wireValue;

    FrequencyUnit(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Accepts "week", "weeks", "month", "months" in any case. Returns {@code null} for
     * anything else so the caller can report the bad value.
     */
    public static FrequencyUnit parse(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim().toLowerCase();
        if (value.equals("week") || value.equals("weeks")) {
            return WEEK;
        }
        if (value.equals("month") || value.equals("months")) {
            return MONTH;
        }
        return null;
    }
}
