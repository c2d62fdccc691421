package com.tenacy.aiops.service;

import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.AnomalyDecision;
import com.tenacy.aiops.domain.DetectionReport;
import com.tenacy.aiops.domain.FeatureMatrix;
import com.tenacy.aiops.domain.LogLine;
import com.tenacy.aiops.domain.Window;
import com.tenacy.aiops.feature.FeatureExtractor;
import com.tenacy.aiops.scoring.OutlierScorer;
import com.tenacy.aiops.source.LogSource;
import com.tenacy.aiops.window.WindowBuilder;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 탐지 실행 한 번: 로그 조회 → 윈도우 → 특징 추출 → 이상 점수 → 알림/조치.
 * <p>
 * 실행 간에 모델이나 윈도우를 보관하지 않는다. 스케줄 실행과 API 실행이 겹치지 않도록 직렬화한다.
 */
@Slf4j
@Service
public class DetectionService {

    private final LogSource logSource;
    private final WindowBuilder windowBuilder;
    private final FeatureExtractor featureExtractor;
    private final OutlierScorer outlierScorer;
    private final DecisionOrchestrator decisionOrchestrator;
    private final DetectionMetrics metrics;
    private final DetectorProperties.Detector detector;

    private final ReentrantLock runLock = new ReentrantLock();

    public DetectionService(LogSource logSource,
                            WindowBuilder windowBuilder,
                            FeatureExtractor featureExtractor,
                            OutlierScorer outlierScorer,
                            DecisionOrchestrator decisionOrchestrator,
                            DetectionMetrics metrics,
                            DetectorProperties properties) {
        this.logSource = logSource;
        this.windowBuilder = windowBuilder;
        this.featureExtractor = featureExtractor;
        this.outlierScorer = outlierScorer;
        this.decisionOrchestrator = decisionOrchestrator;
        this.metrics = metrics;
        this.detector = properties.getDetector();
    }

    public DetectionReport runDetection() {
        runLock.lock();
        try {
            return doRun();
        } finally {
            runLock.unlock();
        }
    }

    private DetectionReport doRun() {
        Instant startedAt = Instant.now();
        Timer.Sample sample = metrics.startRun();
        log.info("AI-Ops detection run starting...");

        List<LogLine> lines = logSource.fetchRecent(Duration.ofMinutes(detector.getRangeMinutes()));
        log.info("Queried {} lines (last {} minutes)", lines.size(), detector.getRangeMinutes());

        List<Window> windows = windowBuilder.build(lines);
        FeatureMatrix features = featureExtractor.extractAll(windows);
        log.info("Built {} windows for detection", features.rowCount());

        Set<Integer> anomalies = outlierScorer.score(features, detector.getContamination());
        List<Integer> sortedAnomalies = new ArrayList<>(anomalies);
        Collections.sort(sortedAnomalies);

        AnomalyDecision decision;
        if (sortedAnomalies.isEmpty()) {
            log.info("No anomalies detected");
            decision = AnomalyDecision.noAnomalies();
        } else {
            log.warn("Detected anomalies in windows: {}", sortedAnomalies);
            decision = decisionOrchestrator.decide(anomalies, features);
        }

        DetectionReport report = DetectionReport.builder()
                .lineCount(lines.size())
                .windowCount(features.rowCount())
                .anomalousWindows(sortedAnomalies)
                .summary(decision.getSummary())
                .notifications(decision.getNotifications())
                .remediation(decision.getOutcome())
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .build();

        metrics.recordRun(report, sample);
        log.info("Detection run finished - anomalies: {}, remediation: {}",
                report.getAnomalyCount(), report.getRemediation().getKind());
        return report;
    }
}
