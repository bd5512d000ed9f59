package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.dto.ServiceTaskRequest;
import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.model.CallerRole;
import com.handyhub.bookingservice.model.ServiceTask;
import com.handyhub.bookingservice.repository.ServiceTaskRepository;
import com.handyhub.bookingservice.security.CallerChecks;
import com.handyhub.bookingservice.security.CallerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ServiceTaskCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(ServiceTaskCatalogService.class);

    private final ServiceTaskRepository serviceTaskRepository;

    public ServiceTaskCatalogService(ServiceTaskRepository serviceTaskRepository) {
        this.serviceTaskRepository = serviceTaskRepository;
    }

    @Transactional(readOnly = true)
    public List<ServiceTask> list() {
        return serviceTaskRepository.findAll(Sort.by("taskName"));
    }

    @Transactional
    public ServiceTask upsert(CallerIdentity caller, ServiceTaskRequest request) {
        CallerChecks.requireRole(caller, CallerRole.ADMIN);
        String name = request.getTaskName() == null ? "" : request.getTaskName().trim();
        if (name.isEmpty()) {
            throw new InvalidInputException("task_name is required");
        }
        int hours = request.getDurationHours() == null ? 0 : request.getDurationHours();
        int minutes = request.getDurationMinutes() == null ? 0 : request.getDurationMinutes();
        if (hours < 0 || minutes < 0 || hours * 60 + minutes == 0) {
            throw new InvalidInputException("Task duration must be positive");
        }

        ServiceTask task = serviceTaskRepository.findByTaskName(name).orElseGet(ServiceTask::new);
        task.setTaskName(name);
        task.setDurationHours(hours);
        task.setDurationMinutes(minutes);
        ServiceTask saved = serviceTaskRepository.save(task);
        logger.info("[ServiceTaskCatalogService] {} set to {}h {}m", name, hours, minutes);
        return saved;
    }
}
