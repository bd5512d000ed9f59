package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handyhub.bookingservice.service.schedule.OccurrenceWindow;

import java.time.LocalDateTime;

public record OccurrenceWindowDto(
        @JsonProperty("occurrence_index") int occurrenceIndex,
        @JsonProperty("service_start") LocalDateTime serviceStart,
        @JsonProperty("service_end") LocalDateTime serviceEnd,
        @JsonProperty("padded_start") LocalDateTime paddedStart,
        @JsonProperty("padded_end") LocalDateTime paddedEnd) {

    public static OccurrenceWindowDto of(int index, OccurrenceWindow window) {
        return new OccurrenceWindowDto(index, window.serviceStart(), window.serviceEnd(),
                window.paddedStart(), window.paddedEnd());
    }
}
