package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.dto.BatchFailure;
import com.handyhub.bookingservice.dto.ReminderScanSummary;
import com.handyhub.bookingservice.model.Engagement;
import com.handyhub.bookingservice.repository.EngagementRepository;
import com.handyhub.bookingservice.util.BookingTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reminds both parties of a recurring occurrence two to three days ahead.
 *
 * <p>The window is widened on both sides by a drift buffer so that a late or early batch run
 * does not miss anything. Each engagement is claimed with a conditional update before any push
 * goes out, so overlapping runs notify at most once.
 */
@Service
public class ReminderScannerService {

    private static final Logger logger = LoggerFactory.getLogger(ReminderScannerService.class);

    static final String SKIP_FIRST_OCCURRENCE = "first_job_of_recurrence";
    static final String REMINDER_TITLE = "Upcoming Scheduled Service";
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("EEE, MMM d 'at' HH:mm", Locale.ENGLISH);

    private final EngagementRepository engagementRepository;
    private final NotificationService notificationService;
    private final TransactionRunner transactionRunner;
    private final Clock clock;
    private final long windowStartHours;
    private final long windowEndHours;
    private final long driftBufferMinutes;

    public ReminderScannerService(EngagementRepository engagementRepository,
                                  NotificationService notificationService,
                                  TransactionRunner transactionRunner,
                                  Clock clock,
                                  @Value("${booking.reminder.window-start-hours:48}") long windowStartHours,
                                  @Value("${booking.reminder.window-end-hours:72}") long windowEndHours,
                                  @Value("${booking.reminder.drift-buffer-minutes:90}") long driftBufferMinutes) {
        this.engagementRepository = engagementRepository;
        this.notificationService = notificationService;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
        this.windowStartHours = windowStartHours;
        this.windowEndHours = windowEndHours;
        this.driftBufferMinutes = driftBufferMinutes;
    }

    public ReminderScanSummary scan() {
        LocalDateTime now = BookingTime.now(clock);
        LocalDateTime windowStart = now.plusHours(windowStartHours).minusMinutes(driftBufferMinutes);
        LocalDateTime windowEnd = now.plusHours(windowEndHours).plusMinutes(driftBufferMinutes);
        List<Engagement> candidates = engagementRepository.findScheduledBetween(windowStart, windowEnd);

        int sent = 0;
        int skippedNotRecurring = 0;
        int skippedAlreadySent = 0;
        int skippedStatus = 0;
        int skippedFirst = 0;
        int skippedMissingParty = 0;
        List<BatchFailure> failures = new ArrayList<>();

        for (Engagement engagement : candidates) {
            try {
                if (!engagement.isRecurringEngagement()) {
                    skippedNotRecurring++;
                    continue;
                }
                if (Boolean.TRUE.equals(engagement.getReminderSent())) {
                    skippedAlreadySent++;
                    continue;
                }
                if (engagement.getStatus() == null || engagement.getStatus().isStopped()) {
                    skippedStatus++;
                    continue;
                }
                if (isFirstOccurrence(engagement)) {
                    claim(engagement.getId(), now, SKIP_FIRST_OCCURRENCE);
                    skippedFirst++;
                    continue;
                }
                if (isBlank(engagement.getClientId()) || isBlank(engagement.getSelectedProviderId())) {
                    skippedMissingParty++;
                    continue;
                }
                if (!claim(engagement.getId(), now, null)) {
                    skippedAlreadySent++;
                    continue;
                }
                remind(engagement);
                sent++;
            } catch (RuntimeException e) {
                logger.error("[ReminderScannerService] Reminder for engagement {} failed", engagement.getId(), e);
                failures.add(new BatchFailure(engagement.getId(), e.getMessage()));
            }
        }

        logger.info("[ReminderScannerService] Window [{}, {}): considered {}, sent {}, skipped first {}, already sent {}, "
                        + "status {}, not recurring {}, missing party {}, failures {}",
                windowStart, windowEnd, candidates.size(), sent, skippedFirst, skippedAlreadySent,
                skippedStatus, skippedNotRecurring, skippedMissingParty, failures.size());
        return new ReminderScanSummary(windowStart, windowEnd, candidates.size(), sent, skippedNotRecurring,
                skippedAlreadySent, skippedStatus, skippedFirst, skippedMissingParty, failures);
    }

    // the first occurrence was just confirmed, so it gets no reminder
    private static boolean isFirstOccurrence(Engagement engagement) {
        if (engagement.getRecurrenceIndex() != null && engagement.getRecurrenceIndex() == 0) {
            return true;
        }
        LocalDateTime anchor = engagement.seriesStart();
        return anchor != null && anchor.equals(engagement.getScheduledDate());
    }

    private boolean claim(Long engagementId, LocalDateTime now, String skipReason) {
        Integer updated = transactionRunner.execute("claim reminder " + engagementId,
                status -> engagementRepository.claimReminder(engagementId, now, skipReason));
        return updated != null && updated > 0;
    }

    private void remind(Engagement engagement) {
        String when = engagement.getScheduledDate().format(DISPLAY_FORMAT);
        String service = engagement.getCategory() != null ? engagement.getCategory() : "home service";
        notificationService.notifyUser(engagement.getClientId(), REMINDER_TITLE,
                "Reminder: your recurring " + service + " service is scheduled for " + when + ".",
                "recurring_reminder", engagement.getId(), "/jobs/" + engagement.getId());
        notificationService.notifyUser(engagement.getSelectedProviderId(), REMINDER_TITLE,
                "Reminder: you have a recurring " + service + " job on " + when + ".",
                "recurring_reminder", engagement.getId(), "/provider/jobs/" + engagement.getId());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
