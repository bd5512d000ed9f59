package com.handyhub.bookingservice.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends per-user push messages on topic {@code user_<uid>}. Delivery problems are logged and
 * swallowed so that the state change which triggered the message stays committed.
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final PushNotificationSender pushNotificationSender;

    public NotificationService(PushNotificationSender pushNotificationSender) {
        this.pushNotificationSender = pushNotificationSender;
    }

    public static String topicFor(String uid) {
        return "user_" + uid;
    }

    /**
     * @return {@code true} if the sender accepted the message
     */
    public boolean notifyUser(String uid, String title, String body, String type, Long engagementId, String route) {
        if (uid == null || uid.isBlank()) {
            return false;
        }
        Map<String, String> data = new LinkedHashMap<>();
        if (type != null) {
            data.put("type", type);
        }
        if (engagementId != null) {
            data.put("jobId", String.valueOf(engagementId));
        }
        if (route != null) {
            data.put("route", route);
        }
        try {
            pushNotificationSender.send(topicFor(uid), title, body, data);
            return true;
        } catch (RuntimeException e) {
            logger.warn("[NotificationService] Push to {} failed ({}): {}", topicFor(uid), type, e.getMessage());
            return false;
        }
    }
}
