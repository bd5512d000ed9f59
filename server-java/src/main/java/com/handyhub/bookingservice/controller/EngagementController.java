package com.handyhub.bookingservice.controller;

import com.handyhub.bookingservice.dto.EngagementCreateRequest;
import com.handyhub.bookingservice.dto.EngagementResponse;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.EngagementService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/engagements")
public class EngagementController {

    private final EngagementService engagementService;

    public EngagementController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    @PostMapping
    public ResponseEntity<EngagementResponse> create(@Valid @RequestBody EngagementCreateRequest request,
                                                     Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EngagementResponse.from(engagementService.create(caller, request)));
    }

    @GetMapping
    public ResponseEntity<List<EngagementResponse>> list(Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(engagementService.listForCaller(caller).stream()
                .map(EngagementResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<EngagementResponse> get(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(EngagementResponse.from(engagementService.get(caller, id)));
    }

    @GetMapping("/{id}/series")
    public ResponseEntity<List<EngagementResponse>> series(@PathVariable Long id, Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(engagementService.listSeries(caller, id).stream()
                .map(EngagementResponse::from)
                .toList());
    }
}
