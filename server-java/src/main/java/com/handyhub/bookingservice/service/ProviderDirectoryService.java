package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.dto.ProviderProfileRequest;
import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.exception.NotFoundException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.ServiceProvider;
import com.handyhub.bookingservice.repository.ServiceProviderRepository;
import com.handyhub.bookingservice.security.CallerChecks;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.util.CategoryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Matchable copy of each provider's profile, keyed by the identity provider's uid.
 */
@Service
public class ProviderDirectoryService {

    private static final Logger logger = LoggerFactory.getLogger(ProviderDirectoryService.class);

    private final ServiceProviderRepository serviceProviderRepository;

    public ProviderDirectoryService(ServiceProviderRepository serviceProviderRepository) {
        this.serviceProviderRepository = serviceProviderRepository;
    }

    @Transactional
    public ServiceProvider upsertOwnProfile(CallerIdentity caller, ProviderProfileRequest request) {
        CallerChecks.requireRole(caller, CallerRole.PROVIDER);
        Set<String> categories = CategoryNormalizer.normalizeAll(request.getCategories());
        if (categories.isEmpty()) {
            throw new InvalidInputException("At least one category is required");
        }

        ServiceProvider provider = serviceProviderRepository.findById(caller.uid()).orElseGet(() -> {
            ServiceProvider created = new ServiceProvider();
            created.setProviderId(caller.uid());
            return created;
        });
        provider.setFirstName(trimToNull(request.getFirstName()));
        provider.setLastName(trimToNull(request.getLastName()));
        provider.setCategories(new LinkedHashSet<>(categories));
        Set<String> languages = new LinkedHashSet<>();
        if (request.getLanguages() != null) {
            request.getLanguages().stream()
                    .map(ProviderDirectoryService::trimToNull)
                    .filter(Objects::nonNull)
                    .forEach(languages::add);
        }
        provider.setLanguages(languages);
        provider.setLatitude(request.getLatitude());
        provider.setLongitude(request.getLongitude());
        provider.setActive(request.getActive() == null || request.getActive());

        ServiceProvider saved = serviceProviderRepository.save(provider);
        logger.info("[ProviderDirectoryService] Provider {} profile saved ({} categories, active={})",
                saved.getProviderId(), categories.size(), saved.getActive());
        return saved;
    }

    @Transactional(readOnly = true)
    public ServiceProvider get(String providerId) {
        return serviceProviderRepository.findById(providerId)
                .orElseThrow(() -> new NotFoundException("Provider not found: " + providerId));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
