package com.handyhub.bookingservice.repository;

import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface EngagementRepository extends JpaRepository<Engagement, Long> {

    List<Engagement> findByRecurringTrue();

    List<Engagement> findByRecurrenceSeriesId(Long recurrenceSeriesId);

    List<Engagement> findByClientIdOrderByScheduledDateAsc(String clientId);

    List<Engagement> findBySelectedProviderIdOrderByScheduledDateAsc(String selectedProviderId);

    @Query("SELECT e FROM Engagement e WHERE e.recurrenceSeriesId = :seriesId " +
            "AND e.recurrenceIndex > 0 AND e.status IN :statuses")
    List<Engagement> findSeriesMembersInStatus(@Param("seriesId") Long seriesId,
                                               @Param("statuses") Collection<EngagementStatus> statuses);

    @Query("SELECT e FROM Engagement e WHERE e.scheduledDate >= :start AND e.scheduledDate < :end " +
            "ORDER BY e.scheduledDate ASC")
    List<Engagement> findScheduledBetween(@Param("start") LocalDateTime start,
                                          @Param("end") LocalDateTime end);

    /**
     * Claims the reminder for one engagement. Returns 1 only for the caller that flipped the flag.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Engagement e SET e.reminderSent = true, e.reminderSentAt = :sentAt, " +
            "e.reminderSkipReason = :skipReason, e.updatedAt = :sentAt " +
            "WHERE e.id = :id AND e.reminderSent = false")
    int claimReminder(@Param("id") Long id,
                      @Param("sentAt") LocalDateTime sentAt,
                      @Param("skipReason") String skipReason);
}
