package com.handyhub.bookingservice.controller;

import com.handyhub.bookingservice.dto.ServiceTaskRequest;
import com.handyhub.bookingservice.model.ServiceTask;
import com.handyhub.bookingservice.security.CallerIdentity;
import com.handyhub.bookingservice.service.ServiceTaskCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ServiceTaskController {

    private final ServiceTaskCatalogService serviceTaskCatalogService;

    public ServiceTaskController(ServiceTaskCatalogService serviceTaskCatalogService) {
        this.serviceTaskCatalogService = serviceTaskCatalogService;
    }

    @GetMapping("/service-tasks")
    public ResponseEntity<List<Map<String, Object>>> list() {
        return ResponseEntity.ok(serviceTaskCatalogService.list().stream().map(ServiceTaskController::toMap).toList());
    }

    @PutMapping("/admin/service-tasks")
    public ResponseEntity<Map<String, Object>> upsert(@Valid @RequestBody ServiceTaskRequest request,
                                                      Authentication authentication) {
        CallerIdentity caller = CallerIdentity.from(authentication);
        return ResponseEntity.ok(toMap(serviceTaskCatalogService.upsert(caller, request)));
    }

    private static Map<String, Object> toMap(ServiceTask task) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", task.getId());
        map.put("task_name", task.getTaskName());
        map.put("duration_hours", task.getDurationHours());
        map.put("duration_minutes", task.getDurationMinutes());
        map.put("minutes_per_unit", task.minutesPerUnit());
        return map;
    }
}
