package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BatchFailure(@JsonProperty("engagement_id") Long engagementId, String message) {
}
