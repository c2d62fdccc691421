package com.tenacy.aiops.service;

import com.tenacy.aiops.domain.DetectionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "aiops.detector", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class DetectionStartupRunner implements ApplicationRunner {

    private final DetectionService detectionService;

    @Override
    public void run(ApplicationArguments args) {
        try {
            DetectionReport report = detectionService.runDetection();
            log.info("Startup detection: {} lines, {} windows, {} anomalies, remediation {}",
                    report.getLineCount(), report.getWindowCount(),
                    report.getAnomalyCount(), report.getRemediation().getKind());
        } catch (Exception e) {
            // 탐지 실패로 기동을 중단하지 않는다
            log.error("Startup detection run failed: {}", e.getMessage(), e);
        }
    }
}
