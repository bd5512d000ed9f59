package com.handyhub.bookingservice.controller;

import com.handyhub.bookingservice.dto.ProviderProfileRequest;
import com.handyhub.bookingservice.dto.ProviderProfileResponse;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.ProviderDirectoryService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/providers")
public class ProviderController {

    private final ProviderDirectoryService providerDirectoryService;

    public ProviderController(ProviderDirectoryService providerDirectoryService) {
        this.providerDirectoryService = providerDirectoryService;
    }

    @PutMapping("/me")
    public ResponseEntity<ProviderProfileResponse> upsertMine(@Valid @RequestBody ProviderProfileRequest request,
                                                              Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(ProviderProfileResponse.from(providerDirectoryService.upsertOwnProfile(caller, request)));
    }

    @GetMapping("/me")
    public ResponseEntity<ProviderProfileResponse> getMine(Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(ProviderProfileResponse.from(providerDirectoryService.get(caller.uid())));
    }

    @GetMapping("/{providerId}")
    public ResponseEntity<ProviderProfileResponse> get(@PathVariable String providerId) {
        return ResponseEntity.ok(ProviderProfileResponse.from(providerDirectoryService.get(providerId)));
    }
}
