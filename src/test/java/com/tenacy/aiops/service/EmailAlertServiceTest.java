package com.tenacy.aiops.service;

import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.NotificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailAlertServiceTest {

    @Mock
    private ObjectProvider<JavaMailSender> mailSenderProvider;

    @Mock
    private JavaMailSender mailSender;

    private DetectorProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DetectorProperties();
        properties.getAlert().getEmail().setSender("aiops@example.com");
        properties.getAlert().getEmail().setRecipients("oncall@example.com,sre@example.com");
    }

    @Test
    @DisplayName("이메일 알림 - 비활성화 상태면 건너뜀")
    void sendAlert_ShouldSkipWhenDisabled() {
        EmailAlertService emailAlertService = new EmailAlertService(mailSenderProvider, properties);

        NotificationResult result = emailAlertService.sendAlert("테스트 알림", "window#0");

        assertEquals(NotificationResult.Status.SKIPPED, result.getStatus());
        verifyNoInteractions(mailSenderProvider);
    }

    @Test
    @DisplayName("이메일 알림 - 수신자 전체에게 전송")
    void sendAlert_ShouldSendToAllRecipients() {
        // given
        properties.getAlert().getEmail().setEnabled(true);
        when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);
        EmailAlertService emailAlertService = new EmailAlertService(mailSenderProvider, properties);

        // when
        NotificationResult result = emailAlertService.sendAlert("AI-Ops Anomaly detected",
                "window#1: avg_len=30.0, errors=0, warns=1, uniq=5");

        // then
        assertTrue(result.isDelivered());
        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage message = captor.getValue();
        assertArrayEquals(new String[]{"oncall@example.com", "sre@example.com"}, message.getTo());
        assertEquals("[AI-Ops 알림] AI-Ops Anomaly detected", message.getSubject());
    }

    @Test
    @DisplayName("이메일 알림 - 메일 서버 오류는 결과로 반환")
    void sendAlert_ShouldReturnFailureOnMailError() {
        // given
        properties.getAlert().getEmail().setEnabled(true);
        when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(SimpleMailMessage.class));
        EmailAlertService emailAlertService = new EmailAlertService(mailSenderProvider, properties);

        // when
        NotificationResult result = emailAlertService.sendAlert("AI-Ops Anomaly detected", "window#0");

        // then
        assertEquals(NotificationResult.Status.FAILED, result.getStatus());
        assertEquals("connection refused", result.getDetail());
    }

    @Test
    @DisplayName("이메일 알림 - JavaMailSender가 없으면 건너뜀")
    void sendAlert_ShouldSkipWithoutMailSender() {
        properties.getAlert().getEmail().setEnabled(true);
        when(mailSenderProvider.getIfAvailable()).thenReturn(null);
        EmailAlertService emailAlertService = new EmailAlertService(mailSenderProvider, properties);

        NotificationResult result = emailAlertService.sendAlert("AI-Ops Anomaly detected", "window#0");

        assertEquals(NotificationResult.Status.SKIPPED, result.getStatus());
    }
}
