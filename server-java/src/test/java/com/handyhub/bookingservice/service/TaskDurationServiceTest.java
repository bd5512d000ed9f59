package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.EngagementTask;
import com.handyhub.bookingservice.model.ServiceTask;
import com.handyhub.bookingservice.repository.ServiceTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TaskDurationServiceTest {

    @Mock
    private ServiceTaskRepository serviceTaskRepository;

    private TaskDurationService taskDurationService;

    @BeforeEach
    void setUp() {
        taskDurationService = new TaskDurationService(serviceTaskRepository);
        when(serviceTaskRepository.findByTaskNameIn(any())).thenReturn(List.of(
                new ServiceTask("Lawn mowing", 1, 30),
                new ServiceTask("Window cleaning", 0, 45)));
    }

    @Test
    void sumsCatalogDurationTimesQuantity() {
        int total = taskDurationService.totalDurationMinutes(List.of(
                new EngagementTask("Lawn mowing", 1),
                new EngagementTask("Window cleaning", 3)));

        assertThat(total).isEqualTo(90 + 3 * 45);
    }

    @Test
    void quantityBelowOneCountsAsOne() {
        assertThat(taskDurationService.totalDurationMinutes(List.of(new EngagementTask("Window cleaning", 0))))
                .isEqualTo(45);
    }

    @Test
    void unknownTaskIsRejected() {
        assertThrows(InvalidInputException.class, () ->
                taskDurationService.totalDurationMinutes(List.of(new EngagementTask("Roof repair", 1))));
    }

    @Test
    void blankLabelIsRejected() {
        assertThrows(InvalidInputException.class, () ->
                taskDurationService.totalDurationMinutes(List.of(new EngagementTask("  ", 1))));
    }

    @Test
    void overflowingQuantityIsRejected() {
        assertThrows(InvalidInputException.class, () ->
                taskDurationService.totalDurationMinutes(List.of(new EngagementTask("Window cleaning", Integer.MAX_VALUE))));
    }

    @Test
    void overflowingSumIsRejected() {
        int halfOfMax = Integer.MAX_VALUE / 45 / 2 + 1;
        assertThrows(InvalidInputException.class, () -> taskDurationService.totalDurationMinutes(List.of(
                new EngagementTask("Window cleaning", halfOfMax),
                new EngagementTask("Window cleaning", halfOfMax))));
    }
}
