package com.handyhub.bookingservice.controller;

import com.handyhub.bookingservice.dto.ReminderScanSummary;
import com.handyhub.bookingservice.dto.SeriesGenerationSummary;
import com.handyhub.bookingservice.service.ReminderScannerService;
import com.handyhub.bookingservice.service.SeriesGeneratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Batch entry points for the external scheduler. Authenticated by the shared cron secret.
 */
@RestController
@RequestMapping("/api/cron")
public class CronController {

    private final SeriesGeneratorService seriesGeneratorService;
    private final ReminderScannerService reminderScannerService;

    public CronController(SeriesGeneratorService seriesGeneratorService,
                          ReminderScannerService reminderScannerService) {
        this.seriesGeneratorService = seriesGeneratorService;
        this.reminderScannerService = reminderScannerService;
    }

    @RequestMapping(value = "/generate-recurring-jobs", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<SeriesGenerationSummary> generateRecurringJobs() {
        return ResponseEntity.ok(seriesGeneratorService.generate());
    }

    @RequestMapping(value = "/recurring-reminders", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<ReminderScanSummary> recurringReminders() {
        return ResponseEntity.ok(reminderScannerService.scan());
    }
}
