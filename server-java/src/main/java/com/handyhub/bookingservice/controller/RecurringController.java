package com.handyhub.bookingservice.controller;

import com.handyhub.bookingservice.dto.EngagementResponse;
import com.handyhub.bookingservice.dto.SeriesEndResponse;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.RecurringLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/engagements/{id}/recurring")
public class RecurringController {

    private final RecurringLifecycleService recurringLifecycleService;

    public RecurringController(RecurringLifecycleService recurringLifecycleService) {
        this.recurringLifecycleService = recurringLifecycleService;
    }

    @PostMapping("/client-end")
    public ResponseEntity<SeriesEndResponse> endByClient(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(SeriesEndResponse.from(recurringLifecycleService.endByClient(caller, id)));
    }

    @PostMapping("/provider-end")
    public ResponseEntity<SeriesEndResponse> endByProvider(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(SeriesEndResponse.from(recurringLifecycleService.endByProvider(caller, id)));
    }

    @PostMapping("/provider-cancel-next")
    public ResponseEntity<EngagementResponse> cancelNext(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(recurringLifecycleService.cancelOccurrenceByProvider(caller, id)));
    }
}
