package com.handyhub.bookingservice.dto;

import com.handyhub.bookingservice.model.ProviderDecision;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DecisionRequest {
    // "accepted" or "declined"
    @NotNull
    private ProviderDecision decision;
}
