package com.handyhub.bookingservice.config;

import com.handyhub.bookingservice.model.ServiceTask;
import com.handyhub.bookingservice.repository.ServiceTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Seeds the service-task catalog on an empty database.
 */
@Component
@ConditionalOnProperty(name = "booking.seed.enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private final ServiceTaskRepository serviceTaskRepository;

    public DataInitializer(ServiceTaskRepository serviceTaskRepository) {
        this.serviceTaskRepository = serviceTaskRepository;
    }

    @Override
    @Transactional
    public void run(String... args) {
        if (serviceTaskRepository.count() > 0) {
            logger.info("[DataInitializer] Service tasks already present, skipping seed data");
            return;
        }
        List<ServiceTask> tasks = List.of(
                new ServiceTask("Lawn mowing", 1, 30),
                new ServiceTask("Hedge trimming", 1, 0),
                new ServiceTask("Gutter cleaning", 2, 0),
                new ServiceTask("Deep cleaning", 3, 0),
                new ServiceTask("Window cleaning", 0, 45),
                new ServiceTask("Faucet repair", 1, 0),
                new ServiceTask("Furniture assembly", 1, 30),
                new ServiceTask("Wall painting", 4, 0));
        serviceTaskRepository.saveAll(tasks);
        logger.info("[DataInitializer] Seeded {} service tasks", tasks.size());
    }
}
