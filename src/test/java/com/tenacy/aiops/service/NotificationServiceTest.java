package com.tenacy.aiops.service;

import com.tenacy.aiops.domain.NotificationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class NotificationServiceTest {

    @Mock
    private AlertService slack;

    @Mock
    private AlertService email;

    @Test
    @DisplayName("알림 - 한 채널의 예외가 다른 채널 전송을 막지 않음")
    void notify_ShouldContinueAfterChannelFailure() {
        // given
        when(slack.getChannel()).thenReturn("slack");
        when(slack.sendAlert("subject", "body")).thenThrow(new IllegalStateException("boom"));
        when(email.sendAlert("subject", "body")).thenReturn(NotificationResult.delivered("email"));
        NotificationService notificationService = new NotificationService(List.of(slack, email));

        // when
        List<NotificationResult> results = notificationService.notify("subject", "body");

        // then
        assertEquals(2, results.size());
        assertEquals(NotificationResult.Status.FAILED, results.get(0).getStatus());
        assertEquals("slack", results.get(0).getChannel());
        assertTrue(results.get(1).isDelivered());
        verify(email).sendAlert("subject", "body");
    }
}
