package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record ReminderScanSummary(
        @JsonProperty("window_start") LocalDateTime windowStart,
        @JsonProperty("window_end") LocalDateTime windowEnd,
        @JsonProperty("considered") int considered,
        @JsonProperty("sent") int sent,
        @JsonProperty("skipped_not_recurring") int skippedNotRecurring,
        @JsonProperty("skipped_already_sent") int skippedAlreadySent,
        @JsonProperty("skipped_status") int skippedStatus,
        @JsonProperty("skipped_first_occurrence") int skippedFirstOccurrence,
        @JsonProperty("skipped_missing_party") int skippedMissingParty,
        @JsonProperty("failures") List<BatchFailure> failures) {
}
