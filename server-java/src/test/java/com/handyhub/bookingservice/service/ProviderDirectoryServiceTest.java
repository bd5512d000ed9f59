package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.dto.ProviderProfileRequest;
import com.handyhub.bookingservice.exception.ForbiddenException;
import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.ServiceProvider;
import com.handyhub.bookingservice.repository.ServiceProviderRepository;
import com.handyhub.bookingservice.security.CallerIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProviderDirectoryServiceTest {

    @Mock
    private ServiceProviderRepository serviceProviderRepository;

    private ProviderDirectoryService providerDirectoryService;
    private final CallerIdentity provider = new CallerIdentity("provider-1", CallerRole.PROVIDER);

    @BeforeEach
    void setUp() {
        providerDirectoryService = new ProviderDirectoryService(serviceProviderRepository);
        when(serviceProviderRepository.findById("provider-1")).thenReturn(Optional.empty());
        when(serviceProviderRepository.save(any(ServiceProvider.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private ProviderProfileRequest request(String... categories) {
        ProviderProfileRequest request = new ProviderProfileRequest();
        request.setFirstName(" Pat ");
        request.setLastName("Lee");
        request.setCategories(Arrays.asList(categories));
        request.setLanguages(List.of("English", " ", "Korean"));
        return request;
    }

    @Test
    void createsProfileWithNormalizedCategories() {
        ServiceProvider saved = providerDirectoryService.upsertOwnProfile(provider,
                request("  Deep   Cleaning", "deep cleaning", "Gardening"));

        assertThat(saved.getProviderId()).isEqualTo("provider-1");
        assertThat(saved.getFirstName()).isEqualTo("Pat");
        assertThat(saved.getCategories()).containsExactlyInAnyOrder("deep cleaning", "gardening");
        assertThat(saved.getLanguages()).containsExactlyInAnyOrder("English", "Korean");
        assertThat(saved.getActive()).isTrue();
    }

    @Test
    void updatesExistingProfileKeepingVersion() {
        ServiceProvider existing = BookingFixtures.provider("provider-1", "plumbing");
        existing.setScheduleVersion(7L);
        when(serviceProviderRepository.findById("provider-1")).thenReturn(Optional.of(existing));
        ProviderProfileRequest request = request("Cleaning");
        request.setActive(false);

        ServiceProvider saved = providerDirectoryService.upsertOwnProfile(provider, request);

        assertThat(saved).isSameAs(existing);
        assertThat(saved.getCategories()).containsExactly("cleaning");
        assertThat(saved.getScheduleVersion()).isEqualTo(7L);
        assertThat(saved.getActive()).isFalse();
    }

    @Test
    void blankCategoriesAreRejected() {
        assertThrows(InvalidInputException.class, () ->
                providerDirectoryService.upsertOwnProfile(provider, request(" ", "")));
        verify(serviceProviderRepository, never()).save(any(ServiceProvider.class));
    }

    @Test
    void clientsCannotPublishAProfile() {
        assertThrows(ForbiddenException.class, () -> providerDirectoryService.upsertOwnProfile(
                new CallerIdentity("client-1", CallerRole.CLIENT), request("cleaning")));
    }
}
