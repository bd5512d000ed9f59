package com.handyhub.bookingservice.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The batch jobs are normally triggered through the cron endpoints by an external scheduler.
 * Setting {@code booking.scheduler.enabled=true} runs them in-process instead.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "booking.scheduler", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
