package com.tenacy.aiops.service;

import com.tenacy.aiops.domain.NotificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 등록된 모든 알림 채널로 전송한다. 한 채널의 실패가 다른 채널이나 이후 조치를 막지 않는다.
 */
@Slf4j
@Service
public class NotificationService {

    private final List<AlertService> channels;

    public NotificationService(List<AlertService> channels) {
        this.channels = new ArrayList<>(channels);
        log.info("Initialized NotificationService with {} channels", this.channels.size());
    }

    public List<NotificationResult> notify(String subject, String message) {
        List<NotificationResult> results = new ArrayList<>(channels.size());

        for (AlertService channel : channels) {
            try {
                results.add(channel.sendAlert(subject, message));
            } catch (Exception e) {
                log.error("Unexpected error from alert channel {}: {}", channel.getChannel(), e.getMessage(), e);
                results.add(NotificationResult.failed(channel.getChannel(), e.getMessage()));
            }
        }
        return results;
    }
}
