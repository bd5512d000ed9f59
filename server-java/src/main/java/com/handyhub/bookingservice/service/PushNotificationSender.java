package com.handyhub.bookingservice.service;

import java.util.Map;

/**
 * Boundary to the push delivery service. Implementations may throw; callers treat any
 * failure as non-fatal.
 */
public interface PushNotificationSender {

    void send(String topic, String title, String body, Map<String, String> data);
}
