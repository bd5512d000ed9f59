package com.handyhub.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.model.RecurrenceDescriptor;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EngagementResponse {
    private Long id;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("client_name")
    private String clientName;

    private String category;

    @JsonProperty("location_text")
    private String locationText;

    private Double latitude;
    private Double longitude;
    private List<TaskLineDto> tasks;

    @JsonProperty("scheduled_date")
    private LocalDateTime scheduledDate;

    private EngagementStatus status;
    private boolean recurring;
    private Recurrence recurrence;

    @JsonProperty("recurrence_series_id")
    private Long recurrenceSeriesId;

    @JsonProperty("recurrence_index")
    private Integer recurrenceIndex;

    @JsonProperty("selected_provider_id")
    private String selectedProviderId;

    @JsonProperty("provider_name")
    private String providerName;

    @JsonProperty("hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @JsonProperty("provider_response_at")
    private LocalDateTime providerResponseAt;

    @JsonProperty("quotation_created_at")
    private LocalDateTime quotationCreatedAt;

    @JsonProperty("quotation_decision_at")
    private LocalDateTime quotationDecisionAt;

    @JsonProperty("visitation_fee_confirmed_at")
    private LocalDateTime visitationFeeConfirmedAt;

    @JsonProperty("invoice_paid_at")
    private LocalDateTime invoicePaidAt;

    @JsonProperty("final_payment_confirmed_at")
    private LocalDateTime finalPaymentConfirmedAt;

    @JsonProperty("reminder_sent")
    private boolean reminderSent;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static EngagementResponse from(Engagement engagement) {
        EngagementResponse response = new EngagementResponse();
        response.setId(engagement.getId());
        response.setClientId(engagement.getClientId());
        response.setClientName(engagement.getClientName());
        response.setCategory(engagement.getCategory());
        response.setLocationText(engagement.getLocationText());
        response.setLatitude(engagement.getLatitude());
        response.setLongitude(engagement.getLongitude());
        response.setTasks(engagement.getTasks().stream()
                .map(task -> new TaskLineDto(task.getLabel(), task.getQuantity()))
                .toList());
        response.setScheduledDate(engagement.getScheduledDate());
        response.setStatus(engagement.getStatus());
        response.setRecurring(engagement.isRecurringEngagement());
        if (engagement.getRecurrence() != null && engagement.isRecurringEngagement()) {
            response.setRecurrence(Recurrence.from(engagement.getRecurrence()));
        }
        response.setRecurrenceSeriesId(engagement.getRecurrenceSeriesId());
        response.setRecurrenceIndex(engagement.getRecurrenceIndex());
        response.setSelectedProviderId(engagement.getSelectedProviderId());
        response.setProviderName(engagement.getProviderName());
        response.setHoldExpiresAt(engagement.getHoldExpiresAt());
        response.setProviderResponseAt(engagement.getProviderResponseAt());
        response.setQuotationCreatedAt(engagement.getQuotationCreatedAt());
        response.setQuotationDecisionAt(engagement.getQuotationDecisionAt());
        response.setVisitationFeeConfirmedAt(engagement.getVisitationFeeConfirmedAt());
        response.setInvoicePaidAt(engagement.getInvoicePaidAt());
        response.setFinalPaymentConfirmedAt(engagement.getFinalPaymentConfirmedAt());
        response.setReminderSent(Boolean.TRUE.equals(engagement.getReminderSent()));
        response.setCreatedAt(engagement.getCreatedAt());
        response.setUpdatedAt(engagement.getUpdatedAt());
        return response;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Recurrence {
        @JsonProperty("preferred_weekday")
        private Integer preferredWeekday;

        @JsonProperty("frequency_unit")
        private String frequencyUnit;

        @JsonProperty("frequency_interval")
        private Integer frequencyInterval;

        @JsonProperty("horizon_count")
        private int horizonCount;

        @JsonProperty("start_at")
        private LocalDateTime startAt;

        @JsonProperty("ended_by")
        private String endedBy;

        @JsonProperty("ended_at")
        private LocalDateTime endedAt;

        static Recurrence from(RecurrenceDescriptor descriptor) {
            Recurrence recurrence = new Recurrence();
            recurrence.setPreferredWeekday(descriptor.getPreferredWeekday());
            recurrence.setFrequencyUnit(descriptor.getFrequencyUnit() != null ? descriptor.getFrequencyUnit().wireValue() : null);
            recurrence.setFrequencyInterval(descriptor.getFrequencyInterval());
            recurrence.setHorizonCount(descriptor.effectiveCount());
            recurrence.setStartAt(descriptor.getStartAt());
            recurrence.setEndedBy(descriptor.getEndedBy());
            recurrence.setEndedAt(descriptor.getEndedAt());
            return recurrence;
        }
    }
}
