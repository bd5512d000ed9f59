package com.handyhub.bookingservice.model;

import com.handyhub.bookingservice.service.schedule.OccurrenceWindow;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "time_blocks",
        indexes = {
                @Index(name = "idx_block_provider_start", columnList = "provider_id, padded_start"),
                @Index(name = "idx_block_job", columnList = "job_id")
        }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeBlock {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TimeBlockStatus status;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "client_id")
    private String clientId;

    @Column(name = "service_start", nullable = false)
    private LocalDateTime serviceStart;

    @Column(name = "service_end", nullable = false)
    private LocalDateTime serviceEnd;

    @Column(name = "padded_start", nullable = false)
    private LocalDateTime paddedStart;

    @Column(name = "padded_end", nullable = false)
    private LocalDateTime paddedEnd;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Column(name = "occurrence_index", nullable = false)
    private Integer occurrenceIndex;

    @Column(name = "recurring", nullable = false)
    private Boolean recurring = Boolean.FALSE;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public OccurrenceWindow window() {
        return new OccurrenceWindow(serviceStart, serviceEnd, paddedStart, paddedEnd);
    }

    /**
     * Held blocks stop counting once their expiry has passed; booked blocks never expire.
     */
    public boolean isActiveAt(LocalDateTime now) {
        if (status == TimeBlockStatus.BOOKED) {
            return true;
        }
        if (status == TimeBlockStatus.HELD) {
            return holdExpiresAt == null || !holdExpiresAt.isBefore(now);
        }
        return false;
    }
}
