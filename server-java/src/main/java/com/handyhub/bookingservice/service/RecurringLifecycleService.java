package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.ConflictException;
import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.exception.NotFoundException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.model.EngagementStatus;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.security.CallerChecks;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.util.BookingTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ending a recurring series, from either side, and the provider skipping one occurrence.
 */
@Service
public class RecurringLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(RecurringLifecycleService.class);

    static final String ENDED_BY_CLIENT = "client";
    static final String ENDED_BY_PROVIDER = "provider";

    private final EngagementRepository engagementRepository;
    private final HoldService holdService;
    private final NotificationService notificationService;
    private final TransactionRunner transactionRunner;
    private final Clock clock;

    public RecurringLifecycleService(EngagementRepository engagementRepository,
                                     HoldService holdService,
                                     NotificationService notificationService,
                                     TransactionRunner transactionRunner,
                                     Clock clock) {
        this.engagementRepository = engagementRepository;
        this.holdService = holdService;
        this.notificationService = notificationService;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
    }

    public SeriesEnded endByClient(CallerIdentity caller, Long engagementId) {
        CallerChecks.requireRole(caller, CallerRole.CLIENT);
        SeriesEnded ended = endSeries(caller, engagementId, EngagementStatus.RECURRING_ENDED, ENDED_BY_CLIENT);
        notificationService.notifyUser(ended.providerId(), "Recurring Service Ended",
                "The client ended the recurring service.", "recurring_ended",
                engagementId, "/provider/jobs/" + engagementId);
        return ended;
    }

    public SeriesEnded endByProvider(CallerIdentity caller, Long engagementId) {
        CallerChecks.requireRole(caller, CallerRole.PROVIDER);
        SeriesEnded ended = endSeries(caller, engagementId, EngagementStatus.PROVIDER_ENDED_RECURRING, ENDED_BY_PROVIDER);
        notificationService.notifyUser(ended.engagement().getClientId(), "Recurring Service Ended",
                "Your provider ended the recurring service.", "provider_ended_recurring",
                engagementId, "/jobs/" + engagementId);
        return ended;
    }

    /**
     * Ends the whole series the engagement belongs to: the root and the named engagement, plus
     * every generated occurrence that has not started yet. The series' blocks are released
     * after the commit.
     */
    private SeriesEnded endSeries(CallerIdentity caller, Long engagementId, EngagementStatus target, String endedBy) {
        SeriesEnded ended = transactionRunner.execute("end series of engagement " + engagementId, status -> {
            Engagement current = load(engagementId);
            if (ENDED_BY_CLIENT.equals(endedBy)) {
                CallerChecks.requireOwner(caller, current);
            } else {
                CallerChecks.requireAssignee(caller, current);
            }
            if (!current.isRecurringEngagement()) {
                throw new InvalidInputException("Engagement " + engagementId + " is not recurring");
            }
            TransitionGuard.requireStatus(current, "end recurring service",
                    EngagementStatus.ACCEPTED, EngagementStatus.SCHEDULED);

            LocalDateTime now = BookingTime.now(clock);
            Long seriesId = current.effectiveSeriesId();
            String providerId = current.getSelectedProviderId();

            int endedCount = 0;
            Engagement root = current.isSeriesRoot()
                    ? current
                    : engagementRepository.findById(seriesId).orElse(null);
            if (root != null && (root.getStatus() == EngagementStatus.ACCEPTED || root.getStatus() == EngagementStatus.SCHEDULED)) {
                markEnded(root, target, endedBy, now);
                engagementRepository.save(root);
                endedCount++;
            }
            if (!current.isSeriesRoot()) {
                markEnded(current, target, endedBy, now);
                engagementRepository.save(current);
                endedCount++;
            }
            List<Engagement> pending = engagementRepository.findSeriesMembersInStatus(seriesId, List.of(EngagementStatus.SCHEDULED));
            for (Engagement member : pending) {
                if (member.getScheduledDate() != null && !member.getScheduledDate().isBefore(now)) {
                    markEnded(member, target, endedBy, now);
                    engagementRepository.save(member);
                    endedCount++;
                }
            }
            return new SeriesEnded(current, seriesId, providerId, endedCount);
        });

        logger.info("[RecurringLifecycleService] Series {} ended by {} ({} engagement(s) -> {})",
                ended.seriesId(), endedBy, ended.endedCount(), target.wireValue());
        holdService.releaseHold(ended.providerId(), ended.seriesId());
        return ended;
    }

    /**
     * The provider cancels one upcoming occurrence. Given the series root, the next scheduled
     * occurrence is taken.
     */
    public Engagement cancelOccurrenceByProvider(CallerIdentity caller, Long engagementId) {
        CallerChecks.requireRole(caller, CallerRole.PROVIDER);
        Engagement cancelled = transactionRunner.execute("cancel occurrence " + engagementId, status -> {
            Engagement target = load(engagementId);
            if (!target.isRecurringEngagement()) {
                throw new InvalidInputException("Engagement " + engagementId + " is not recurring");
            }
            if (target.isSeriesRoot()) {
                CallerChecks.requireAssignee(caller, target);
                target = nextScheduledOccurrence(target);
            }
            CallerChecks.requireAssignee(caller, target);
            TransitionGuard.requireStatus(target, "cancel occurrence", EngagementStatus.SCHEDULED);
            target.setStatus(EngagementStatus.NEXT_CANCELLED_BY_PROVIDER);
            return engagementRepository.save(target);
        });

        logger.info("[RecurringLifecycleService] Provider {} cancelled occurrence {} of series {}",
                caller.uid(), cancelled.getRecurrenceIndex(), cancelled.getRecurrenceSeriesId());
        holdService.releaseOccurrence(caller.uid(), cancelled.timeBlockJobId(), cancelled.getRecurrenceIndex());
        notificationService.notifyUser(cancelled.getClientId(), "Upcoming Service Cancelled",
                "Your provider cancelled the upcoming service on " + cancelled.getScheduledDate() + ".",
                "next_cancelled_by_provider", cancelled.getId(), "/jobs/" + cancelled.getId());
        return cancelled;
    }

    private Engagement nextScheduledOccurrence(Engagement root) {
        LocalDateTime now = BookingTime.now(clock);
        return engagementRepository.findSeriesMembersInStatus(root.effectiveSeriesId(), List.of(EngagementStatus.SCHEDULED))
                .stream()
                .filter(member -> member.getScheduledDate() != null && member.getScheduledDate().isAfter(now))
                .min(Comparator.comparing(Engagement::getScheduledDate))
                .orElseThrow(() -> new ConflictException("No upcoming occurrence to cancel",
                        Map.of("engagement_id", root.getId())));
    }

    private static void markEnded(Engagement engagement, EngagementStatus target, String endedBy, LocalDateTime now) {
        engagement.setStatus(target);
        if (engagement.getRecurrence() != null) {
            engagement.getRecurrence().setEndedBy(endedBy);
            engagement.getRecurrence().setEndedAt(now);
        }
    }

    private Engagement load(Long engagementId) {
        return engagementRepository.findById(engagementId)
                .orElseThrow(() -> new NotFoundException("Engagement not found: " + engagementId));
    }

    public record SeriesEnded(Engagement engagement, Long seriesId, String providerId, int endedCount) {
    }
}
