package com.handyhub.bookingservice.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Default sender for environments without a push gateway: records the message in the log.
 */
@Configuration
public class LoggingPushNotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(LoggingPushNotificationSender.class);

    @Bean
    @ConditionalOnMissingBean(PushNotificationSender.class)
    public PushNotificationSender pushNotificationSender() {
        return (String topic, String title, String body, Map<String, String> data) ->
                logger.info("[Push] topic={} title=\"{}\" body=\"{}\" data={}", topic, title, body, data);
    }
}
