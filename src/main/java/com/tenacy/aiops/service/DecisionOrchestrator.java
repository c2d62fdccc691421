package com.tenacy.aiops.service;

import com.tenacy.aiops.domain.AnomalyDecision;
import com.tenacy.aiops.domain.FeatureMatrix;
import com.tenacy.aiops.domain.FeatureVector;
import com.tenacy.aiops.domain.NotificationResult;
import com.tenacy.aiops.domain.RemediationOutcome;
import com.tenacy.aiops.remediation.RemediationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 이상 윈도우 요약을 만들고 알림 후 자동 조치를 수행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionOrchestrator {

    static final String ALERT_SUBJECT = "AI-Ops Anomaly detected";

    private final NotificationService notificationService;
    private final RemediationService remediationService;

    public AnomalyDecision decide(Set<Integer> anomalousIndices, FeatureMatrix features) {
        if (anomalousIndices == null || anomalousIndices.isEmpty()) {
            return AnomalyDecision.noAnomalies();
        }

        String summary = summarize(anomalousIndices, features);

        // 알림 실패와 관계없이 조치는 항상 시도
        List<NotificationResult> notifications = notificationService.notify(ALERT_SUBJECT, summary);
        RemediationOutcome outcome = remediationService.remediate(summary);

        log.info("Remediation result: {} {}", outcome.getKind(),
                outcome.getLocator() != null ? outcome.getLocator() : "");
        return new AnomalyDecision(summary, notifications, outcome);
    }

    /**
     * 이상 윈도우마다 한 줄, 인덱스 오름차순.
     */
    public String summarize(Set<Integer> anomalousIndices, FeatureMatrix features) {
        List<Integer> sorted = new ArrayList<>(anomalousIndices);
        Collections.sort(sorted);

        return sorted.stream()
                .map(index -> formatLine(index, features.row(index)))
                .collect(Collectors.joining("\n"));
    }

    private static String formatLine(int index, FeatureVector vector) {
        return String.format(Locale.ROOT, "window#%d: avg_len=%.1f, errors=%d, warns=%d, uniq=%d",
                index,
                vector.getAvgLength(),
                vector.getErrorCount(),
                vector.getWarnCount(),
                vector.getUniqueCount());
    }
}
