package com.handyhub.bookingservice.repository;

import com.handyhub.bookingservice.model.TimeBlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TimeBlockRepository extends JpaRepository<TimeBlock, Long> {

    // single inequality on purpose; the lower bound is checked in Java
    List<TimeBlock> findByProviderIdAndPaddedStartBefore(String providerId, LocalDateTime paddedEnd);

    List<TimeBlock> findByProviderIdAndJobIdOrderByOccurrenceIndexAsc(String providerId, Long jobId);

    @Modifying
    @Query("DELETE FROM TimeBlock b WHERE b.providerId = :providerId AND b.jobId = :jobId")
    int deleteForJob(@Param("providerId") String providerId, @Param("jobId") Long jobId);

    // every provider, used when a job is re-held
    @Modifying
    @Query("DELETE FROM TimeBlock b WHERE b.jobId = :jobId")
    int deleteAllForJob(@Param("jobId") Long jobId);

    @Modifying
    @Query("DELETE FROM TimeBlock b WHERE b.providerId = :providerId AND b.jobId = :jobId " +
            "AND b.occurrenceIndex = :occurrenceIndex")
    int deleteForOccurrence(@Param("providerId") String providerId,
                            @Param("jobId") Long jobId,
                            @Param("occurrenceIndex") Integer occurrenceIndex);

    @Modifying
    @Query("DELETE FROM TimeBlock b WHERE b.status = com.handyhub.bookingservice.model.TimeBlockStatus.HELD " +
            "AND b.holdExpiresAt < :now")
    int deleteExpiredHolds(@Param("now") LocalDateTime now);
}
