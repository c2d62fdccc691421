package com.tenacy.aiops.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 주기 탐지. aiops.detector.schedule.enabled=true 일 때만 등록된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "aiops.detector.schedule", name = "enabled", havingValue = "true")
public class DetectionScheduler {

    private final DetectionService detectionService;

    @Scheduled(fixedDelayString = "${aiops.detector.schedule.interval:5m}",
            initialDelayString = "${aiops.detector.schedule.interval:5m}")
    public void scheduledDetection() {
        try {
            detectionService.runDetection();
        } catch (Exception e) {
            log.error("Scheduled detection run failed: {}", e.getMessage(), e);
        }
    }
}
