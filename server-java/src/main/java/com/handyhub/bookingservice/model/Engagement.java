package com.handyhub.bookingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Entity
@Table(
        name = "engagements",
        indexes = {
                @Index(name = "idx_engagement_client", columnList = "client_id"),
                @Index(name = "idx_engagement_scheduled", columnList = "scheduled_date")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Engagement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id", nullable = false)
    private String clientId;

    @Column(name = "client_name")
    private String clientName;

    @Column(name = "category", nullable = false)
    private String category; // normalized: trimmed, lower-case

    @Column(name = "location_text", length = 1024)
    private String locationText;

    @Column(name = "latitude", nullable = false)
    private Double latitude;

    @Column(name = "longitude", nullable = false)
    private Double longitude;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "engagement_tasks", joinColumns = @JoinColumn(name = "engagement_id"))
    @OrderColumn(name = "task_order")
    private List<EngagementTask> tasks = new ArrayList<>();

    @Column(name = "scheduled_date", nullable = false)
    private LocalDateTime scheduledDate;

    @Column(name = "recurring", nullable = false)
    private Boolean recurring = Boolean.FALSE;

    @Embedded
    private RecurrenceDescriptor recurrence;

    @Column(name = "recurrence_series_id")
    private Long recurrenceSeriesId;

    @Column(name = "recurrence_index")
    private Integer recurrenceIndex;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EngagementStatus status = EngagementStatus.OPEN;

    @Column(name = "selected_provider_id")
    private String selectedProviderId;

    @Column(name = "provider_name")
    private String providerName;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Column(name = "provider_response_at")
    private LocalDateTime providerResponseAt;

    @Column(name = "quotation_created_at")
    private LocalDateTime quotationCreatedAt;

    @Column(name = "quotation_decision_at")
    private LocalDateTime quotationDecisionAt;

    @Column(name = "visitation_fee_confirmed_at")
    private LocalDateTime visitationFeeConfirmedAt;

    @Column(name = "invoice_paid_at")
    private LocalDateTime invoicePaidAt;

    @Column(name = "final_payment_confirmed_at")
    private LocalDateTime finalPaymentConfirmedAt;

    @Column(name = "reminder_sent", nullable = false)
    private Boolean reminderSent = Boolean.FALSE;

    @Column(name = "reminder_sent_at")
    private LocalDateTime reminderSentAt;

    @Column(name = "reminder_skip_reason")
    private String reminderSkipReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    public void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (reminderSent == null) {
            reminderSent = false;
        }
        if (recurring == null) {
            recurring = false;
        }
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isRecurringEngagement() {
        return Boolean.TRUE.equals(recurring);
    }

    /**
     * A series root is a recurring engagement that was not generated from another one.
     */
    public boolean isSeriesRoot() {
        return isRecurringEngagement() && (recurrenceIndex == null || recurrenceIndex == 0);
    }

    public Long effectiveSeriesId() {
        return recurrenceSeriesId != null ? recurrenceSeriesId : id;
    }

    /**
     * Time blocks of a series are written against the root, so members resolve to the
     * series id and their own index.
     */
    public Long timeBlockJobId() {
        if (isRecurringEngagement() && recurrenceIndex != null && recurrenceIndex > 0) {
            return recurrenceSeriesId;
        }
        return id;
    }

    public LocalDateTime seriesStart() {
        if (recurrence != null && recurrence.getStartAt() != null) {
            return recurrence.getStartAt();
        }
        return scheduledDate;
    }

    public boolean isOwnedBy(String uid) {
        return uid != null && uid.equals(clientId);
    }

    public boolean isAssignedTo(String uid) {
        return uid != null && Objects.equals(uid, selectedProviderId);
    }

    public void clearProviderSelection() {
        selectedProviderId = null;
        providerName = null;
        holdExpiresAt = null;
    }
}
