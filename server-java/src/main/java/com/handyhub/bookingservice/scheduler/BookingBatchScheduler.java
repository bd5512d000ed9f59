package com.handyhub.bookingservice.scheduler;

import com.handyhub.bookingservice.dto.ReminderScanSummary;
import com.handyhub.bookingservice.dto.SeriesGenerationSummary;
import com.handyhub.bookingservice.service.HoldService;
import com.handyhub.bookingservice.service.ReminderScannerService;
import com.handyhub.bookingservice.service.SeriesGeneratorService;
import com.handyhub.bookingservice.util.BookingTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * In-process trigger for the batch jobs. Off unless {@code booking.scheduler.enabled=true}.
 * cron: second minute hour day month weekday
 */
@Component
@ConditionalOnProperty(prefix = "booking.scheduler", name = "enabled", havingValue = "true")
public class BookingBatchScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BookingBatchScheduler.class);

    private final SeriesGeneratorService seriesGeneratorService;
    private final ReminderScannerService reminderScannerService;
    private final HoldService holdService;
    private final Clock clock;

    public BookingBatchScheduler(SeriesGeneratorService seriesGeneratorService,
                                 ReminderScannerService reminderScannerService,
                                 HoldService holdService,
                                 Clock clock) {
        this.seriesGeneratorService = seriesGeneratorService;
        this.reminderScannerService = reminderScannerService;
        this.holdService = holdService;
        this.clock = clock;
    }

    @Scheduled(cron = "${booking.scheduler.series-cron:0 0 3 * * ?}")
    public void generateRecurringJobs() {
        try {
            SeriesGenerationSummary summary = seriesGeneratorService.generate();
            logger.info("[BookingBatchScheduler] Series generation: {} generated, {} failure(s)",
                    summary.generated(), summary.failures().size());
        } catch (RuntimeException e) {
            logger.error("[BookingBatchScheduler] Series generation failed", e);
        }
    }

    @Scheduled(cron = "${booking.scheduler.reminder-cron:0 0 * * * ?}")
    public void sendRecurringReminders() {
        try {
            ReminderScanSummary summary = reminderScannerService.scan();
            logger.info("[BookingBatchScheduler] Reminder scan: {} sent of {} considered",
                    summary.sent(), summary.considered());
        } catch (RuntimeException e) {
            logger.error("[BookingBatchScheduler] Reminder scan failed", e);
        }
    }

    @Scheduled(cron = "${booking.scheduler.hold-purge-cron:0 */15 * * * ?}")
    public void purgeExpiredHolds() {
        try {
            holdService.purgeExpiredHolds(BookingTime.now(clock));
        } catch (RuntimeException e) {
            logger.error("[BookingBatchScheduler] Hold purge failed", e);
        }
    }
}
