package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.EngagementTask;
import com.handyhub.bookingservice.model.ServiceTask;
import com.handyhub.bookingservice.repository.ServiceTaskRepository;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sums the catalog duration of an engagement's line items.
 */
@Service
public class TaskDurationService {

    private final ServiceTaskRepository serviceTaskRepository;

    public TaskDurationService(ServiceTaskRepository serviceTaskRepository) {
        this.serviceTaskRepository = serviceTaskRepository;
    }

    public int totalDurationMinutes(List<EngagementTask> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return 0;
        }
        Set<String> labels = tasks.stream()
                .map(task -> task.getLabel() == null ? "" : task.getLabel().trim())
                .filter(label -> !label.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<String, ServiceTask> catalog = serviceTaskRepository.findByTaskNameIn(labels).stream()
                .collect(Collectors.toMap(ServiceTask::getTaskName, Function.identity(), (a, b) -> a));

        int total = 0;
        for (EngagementTask task : tasks) {
            String label = task.getLabel() == null ? "" : task.getLabel().trim();
            if (label.isEmpty()) {
                throw new InvalidInputException("Task label is required");
            }
            ServiceTask serviceTask = catalog.get(label);
            if (serviceTask == null) {
                throw new InvalidInputException("Unknown service task: " + label);
            }
            int quantity = task.getQuantity() == null ? 1 : Math.max(1, task.getQuantity());
            try {
                total = Math.addExact(total, Math.multiplyExact(serviceTask.minutesPerUnit(), quantity));
            } catch (ArithmeticException e) {
                throw new InvalidInputException("Total task duration is too large (" + label + " x " + quantity + ")");
            }
        }
        return total;
    }
}
