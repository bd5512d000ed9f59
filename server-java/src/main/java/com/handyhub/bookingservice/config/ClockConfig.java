package com.handyhub.bookingservice.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    /**
     * All scheduling arithmetic runs on local wall-clock time of this zone.
     */
    @Bean
    public Clock bookingClock(@Value("${booking.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
