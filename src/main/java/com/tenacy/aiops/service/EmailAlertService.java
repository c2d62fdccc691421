package com.tenacy.aiops.service;

import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.NotificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.annotation.Order;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@Order(2)
public class EmailAlertService implements AlertService {

    static final String CHANNEL = "email";

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final DetectorProperties.Email email;

    public EmailAlertService(ObjectProvider<JavaMailSender> mailSenderProvider,
                             DetectorProperties properties) {
        this.mailSenderProvider = mailSenderProvider;
        this.email = properties.getAlert().getEmail();
    }

    @Override
    public String getChannel() {
        return CHANNEL;
    }

    @Override
    public NotificationResult sendAlert(String subject, String message) {
        if (!email.isEnabled()) {
            return NotificationResult.skipped(CHANNEL, "email alerts disabled");
        }

        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null || !isEmailConfigValid()) {
            log.warn("알림 이메일 설정이 올바르지 않아 전송을 건너뜁니다 (spring.mail.host, sender, recipients 확인)");
            return NotificationResult.skipped(CHANNEL, "mail sender not configured");
        }

        try {
            SimpleMailMessage mailMessage = new SimpleMailMessage();
            mailMessage.setFrom(email.getSender());
            mailMessage.setTo(email.getRecipients().split(","));
            mailMessage.setSubject("[AI-Ops 알림] " + subject);
            mailMessage.setText(message);

            mailSender.send(mailMessage);
            log.info("알림 이메일이 성공적으로 전송되었습니다: {}", subject);
            return NotificationResult.delivered(CHANNEL);
        } catch (Exception e) {
            log.error("알림 이메일 전송 실패: {}", e.getMessage(), e);
            return NotificationResult.failed(CHANNEL, e.getMessage());
        }
    }

    private boolean isEmailConfigValid() {
        return StringUtils.hasText(email.getSender()) &&
                StringUtils.hasText(email.getRecipients());
    }
}
