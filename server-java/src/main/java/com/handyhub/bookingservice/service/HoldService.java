package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.ConflictException;
import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.exception.NotFoundException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.model.ProviderDecision;
import com.handyhub.bookingservice.model.ServiceProvider;
import com.handyhub.bookingservice.model.TimeBlock;
import com.handyhub.bookingservice.model.TimeBlockStatus;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.repository.ServiceProviderRepository;
import com.handyhub.bookingservice.repository.TimeBlockRepository;
import com.handyhub.bookingservice.security.CallerChecks;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.schedule.OccurrencePlanner;
import com.handyhub.bookingservice.service.schedule.OccurrencePlanner.OccurrencePlan;
import com.handyhub.bookingservice.service.schedule.OccurrenceWindow;
import com.handyhub.bookingservice.util.BookingTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Soft reservations of a provider's time.
 *
 * <p>A hold is written in one transaction per provider: the provider's schedule version is
 * bumped first, which takes SQLite's write lock, then every occurrence is re-checked and the
 * held blocks are inserted. Two clients racing for the same slot are therefore serialized and
 * the loser sees the winner's blocks.
 */
@Service
public class HoldService {

    private static final Logger logger = LoggerFactory.getLogger(HoldService.class);

    private final EngagementRepository engagementRepository;
    private final TimeBlockRepository timeBlockRepository;
    private final ServiceProviderRepository serviceProviderRepository;
    private final AvailabilityService availabilityService;
    private final OccurrencePlanner occurrencePlanner;
    private final NotificationService notificationService;
    private final TransactionRunner transactionRunner;
    private final Clock clock;
    private final long ttlMinutes;

    public HoldService(EngagementRepository engagementRepository,
                       TimeBlockRepository timeBlockRepository,
                       ServiceProviderRepository serviceProviderRepository,
                       AvailabilityService availabilityService,
                       OccurrencePlanner occurrencePlanner,
                       NotificationService notificationService,
                       TransactionRunner transactionRunner,
                       Clock clock,
                       @Value("${booking.hold.ttl-minutes:10}") long ttlMinutes) {
        this.engagementRepository = engagementRepository;
        this.timeBlockRepository = timeBlockRepository;
        this.serviceProviderRepository = serviceProviderRepository;
        this.availabilityService = availabilityService;
        this.occurrencePlanner = occurrencePlanner;
        this.notificationService = notificationService;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
        this.ttlMinutes = ttlMinutes > 0 ? ttlMinutes : 10;
    }

    /**
     * Holds {@code providerId} for every occurrence of the engagement and moves it to
     * {@code requested}. Nothing is written when any occurrence conflicts.
     */
    public HoldResult createHolds(CallerIdentity caller, Long engagementId, String providerId) {
        CallerChecks.requireRole(caller, CallerRole.CLIENT);
        if (providerId == null || providerId.isBlank()) {
            throw new InvalidInputException("provider_id is required");
        }
        String provider = providerId.trim();

        HoldResult result = transactionRunner.execute("hold provider " + provider,
                status -> holdInTransaction(caller, engagementId, provider));

        logger.info("[HoldService] Engagement {} held provider {} for {} occurrence(s) until {}",
                engagementId, provider, result.holdIds().size(), result.holdExpiresAt());
        notificationService.notifyUser(provider, "New Job Request",
                "A client has requested you for a job. Please respond before the hold expires.",
                "job_request", engagementId, "/provider/jobs/" + engagementId);
        return result;
    }

    private HoldResult holdInTransaction(CallerIdentity caller, Long engagementId, String providerId) {
        // must stay the first statement: it serializes writers for this provider
        if (serviceProviderRepository.bumpScheduleVersion(providerId) == 0) {
            throw new NotFoundException("Provider not found: " + providerId);
        }
        ServiceProvider provider = serviceProviderRepository.findById(providerId)
                .orElseThrow(() -> new NotFoundException("Provider not found: " + providerId));
        if (!Boolean.TRUE.equals(provider.getActive())) {
            throw new InvalidInputException("Provider " + providerId + " is not accepting jobs");
        }

        Engagement engagement = engagementRepository.findById(engagementId)
                .orElseThrow(() -> new NotFoundException("Engagement not found: " + engagementId));
        CallerChecks.requireOwner(caller, engagement);
        if (engagement.isRecurringEngagement() && !engagement.isSeriesRoot()) {
            throw new InvalidInputException("Occurrences of a series cannot be held individually; hold the series root");
        }
        if (!engagement.getStatus().isHoldable()) {
            throw ConflictException.invalidState(engagement.getId(), engagement.getStatus(), "hold a provider");
        }

        LocalDateTime now = BookingTime.now(clock);
        OccurrencePlan plan = occurrencePlanner.plan(engagement);
        List<OccurrenceWindow> windows = plan.windows();

        // a re-hold replaces whatever this job held before
        timeBlockRepository.deleteAllForJob(engagement.getId());

        OptionalInt conflict = availabilityService.firstConflict(providerId, windows, now);
        if (conflict.isPresent()) {
            int index = conflict.getAsInt();
            throw ConflictException.occurrenceUnavailable(providerId, index, windows.get(index).serviceStart());
        }

        LocalDateTime expiresAt = now.plusMinutes(ttlMinutes);
        List<Long> holdIds = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            OccurrenceWindow window = windows.get(i);
            TimeBlock block = new TimeBlock();
            block.setProviderId(providerId);
            block.setStatus(TimeBlockStatus.HELD);
            block.setJobId(engagement.getId());
            block.setClientId(engagement.getClientId());
            block.setServiceStart(window.serviceStart());
            block.setServiceEnd(window.serviceEnd());
            block.setPaddedStart(window.paddedStart());
            block.setPaddedEnd(window.paddedEnd());
            block.setHoldExpiresAt(expiresAt);
            block.setOccurrenceIndex(i);
            block.setRecurring(engagement.isRecurringEngagement());
            block.setCreatedAt(now);
            holdIds.add(timeBlockRepository.save(block).getId());
        }

        engagement.setStatus(EngagementStatus.REQUESTED);
        engagement.setSelectedProviderId(providerId);
        engagement.setProviderName(provider.displayName());
        engagement.setHoldExpiresAt(expiresAt);
        engagement.setProviderResponseAt(null);
        if (engagement.isRecurringEngagement()) {
            // anchor the series on the weekday-aligned first occurrence
            LocalDateTime first = windows.get(0).serviceStart();
            engagement.getRecurrence().setStartAt(first);
            engagement.setScheduledDate(first);
        }
        engagementRepository.save(engagement);

        return new HoldResult(engagement.getId(), providerId, List.copyOf(holdIds), expiresAt,
                plan.totalDurationMinutes(), windows);
    }

    /**
     * Applies the provider's answer to the blocks of {@code jobId}. Must run inside the caller's
     * transaction, after the provider's schedule version was bumped.
     *
     * @return the blocks after the change; empty for a decline
     */
    public List<TimeBlock> resolveHolds(String providerId, Long jobId, ProviderDecision decision) {
        if (decision == ProviderDecision.DECLINED) {
            int deleted = timeBlockRepository.deleteAllForJob(jobId);
            logger.info("[HoldService] Provider {} declined job {}: removed {} block(s)", providerId, jobId, deleted);
            return List.of();
        }

        List<TimeBlock> blocks = timeBlockRepository.findByProviderIdAndJobIdOrderByOccurrenceIndexAsc(providerId, jobId);
        if (blocks.isEmpty()) {
            throw new ConflictException("No hold remains for this job; the client has to select the provider again",
                    Map.of("provider_id", providerId, "engagement_id", jobId));
        }
        LocalDateTime now = BookingTime.now(clock);
        for (TimeBlock block : blocks) {
            if (block.getStatus() != TimeBlockStatus.HELD) {
                continue;
            }
            if (!block.isActiveAt(now)
                    && availabilityService.hasConflict(providerId, block.window(), now, jobId)) {
                throw ConflictException.occurrenceUnavailable(providerId, block.getOccurrenceIndex(), block.getServiceStart());
            }
            block.setStatus(TimeBlockStatus.BOOKED);
            block.setHoldExpiresAt(null);
        }
        List<TimeBlock> saved = timeBlockRepository.saveAll(blocks);
        logger.info("[HoldService] Booked {} block(s) of job {} for provider {}", saved.size(), jobId, providerId);
        return saved;
    }

    /**
     * Deletes every block the provider has for the job. Never throws.
     */
    public boolean releaseHold(String providerId, Long jobId) {
        if (providerId == null || jobId == null) {
            return false;
        }
        try {
            Integer deleted = transactionRunner.execute("release job " + jobId,
                    status -> timeBlockRepository.deleteForJob(providerId, jobId));
            logger.info("[HoldService] Released {} block(s) of job {} for provider {}", deleted, jobId, providerId);
            return true;
        } catch (RuntimeException e) {
            logger.warn("[HoldService] Release of job {} for provider {} failed: {}", jobId, providerId, e.getMessage());
            return false;
        }
    }

    /**
     * Deletes the single block of one series occurrence. Never throws.
     */
    public boolean releaseOccurrence(String providerId, Long jobId, Integer occurrenceIndex) {
        if (providerId == null || jobId == null || occurrenceIndex == null) {
            return false;
        }
        try {
            Integer deleted = transactionRunner.execute("release occurrence " + occurrenceIndex + " of job " + jobId,
                    status -> timeBlockRepository.deleteForOccurrence(providerId, jobId, occurrenceIndex));
            logger.info("[HoldService] Released occurrence {} of job {} for provider {} ({} block(s))",
                    occurrenceIndex, jobId, providerId, deleted);
            return true;
        } catch (RuntimeException e) {
            logger.warn("[HoldService] Release of occurrence {} of job {} failed: {}", occurrenceIndex, jobId, e.getMessage());
            return false;
        }
    }

    /**
     * Garbage-collects holds that expired before {@code now}. Availability already ignores
     * them, so this only keeps the table small.
     */
    public int purgeExpiredHolds(LocalDateTime now) {
        Integer purged = transactionRunner.execute("purge expired holds",
                status -> timeBlockRepository.deleteExpiredHolds(now));
        int count = purged != null ? purged : 0;
        if (count > 0) {
            logger.info("[HoldService] Purged {} expired hold(s)", count);
        }
        return count;
    }
}
