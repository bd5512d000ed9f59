package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record SeriesGenerationSummary(
        @JsonProperty("scanned") int scanned,
        @JsonProperty("generated") int generated,
        @JsonProperty("created_by_series") Map<Long, Integer> createdBySeries,
        @JsonProperty("failures") List<BatchFailure> failures) {

    public boolean ok() {
        return failures.isEmpty();
    }
}
