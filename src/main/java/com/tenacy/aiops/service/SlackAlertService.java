package com.tenacy.aiops.service;

import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.NotificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Slf4j
@Service
@Order(1)
public class SlackAlertService implements AlertService {

    static final String CHANNEL = "slack";

    private final RestTemplate restTemplate;
    private final DetectorProperties.Slack slack;

    public SlackAlertService(@Qualifier("slackRestTemplate") RestTemplate restTemplate,
                             DetectorProperties properties) {
        this.restTemplate = restTemplate;
        this.slack = properties.getAlert().getSlack();
    }

    @Override
    public String getChannel() {
        return CHANNEL;
    }

    @Override
    public NotificationResult sendAlert(String subject, String message) {
        String text = "🚨 " + subject + ":\n" + message;

        if (!slack.isConfigured()) {
            log.info("No Slack webhook configured; skipping Slack alert. Message would be: {}", text);
            return NotificationResult.skipped(CHANNEL, "webhook not configured");
        }

        try {
            restTemplate.postForEntity(slack.getWebhookUrl(), Map.of("text", text), String.class);
            log.info("Slack alert sent: {}", subject);
            return NotificationResult.delivered(CHANNEL);
        } catch (Exception e) {
            log.error("Failed to send Slack alert: {}", e.getMessage(), e);
            return NotificationResult.failed(CHANNEL, e.getMessage());
        }
    }
}
