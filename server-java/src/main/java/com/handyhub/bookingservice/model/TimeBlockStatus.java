package com.handyhub.bookingservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimeBlockStatus {
    HELD("held"),
    BOOKED("booked");

    private final String wireValue;

    TimeBlockStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
