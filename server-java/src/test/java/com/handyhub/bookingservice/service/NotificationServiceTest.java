package com.handyhub.bookingservice.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private PushNotificationSender pushNotificationSender;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(pushNotificationSender);
    }

    @Test
    void sendsToPerUserTopicWithRoutingData() {
        boolean sent = notificationService.notifyUser("u42", "Job Accepted", "body", "job_accepted", 9L, "/jobs/9");

        assertThat(sent).isTrue();
        verify(pushNotificationSender).send("user_u42", "Job Accepted", "body",
                Map.of("type", "job_accepted", "jobId", "9", "route", "/jobs/9"));
    }

    @Test
    void deliveryFailureIsSwallowed() {
        doThrow(new IllegalStateException("push backend down"))
                .when(pushNotificationSender).send(anyString(), anyString(), anyString(), any());

        assertThat(notificationService.notifyUser("u42", "t", "b", "x", 1L, null)).isFalse();
    }

    @Test
    void missingRecipientIsSkipped() {
        assertThat(notificationService.notifyUser(null, "t", "b", "x", 1L, null)).isFalse();
        verify(pushNotificationSender, never()).send(anyString(), anyString(), anyString(), anyMap());
    }
}
