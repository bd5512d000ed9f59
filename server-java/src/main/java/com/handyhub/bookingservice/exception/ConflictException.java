package com.handyhub.bookingservice.exception;

import com.handyhub.bookingservice.model.EngagementStatus;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

public class ConflictException extends BookingException {

    public ConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFLICT, message, details, null);
    }

    public static ConflictException occurrenceUnavailable(String providerId, int occurrenceIndex, LocalDateTime serviceStart) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider_id", providerId);
        details.put("occurrence_index", occurrenceIndex);
        details.put("occurrence_start", serviceStart.toString());
        return new ConflictException(
                "Provider unavailable: occurrence " + occurrenceIndex + " at " + serviceStart
                        + " overlaps an existing booking or hold. Please select another provider.",
                details);
    }

    public static ConflictException invalidState(Long engagementId, EngagementStatus current, String action) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("engagement_id", engagementId);
        details.put("status", current != null ? current.wireValue() : null);
        details.put("action", action);
        return new ConflictException(
                "Cannot " + action + " while engagement is " + (current != null ? current.wireValue() : "unknown"),
                details);
    }
}
