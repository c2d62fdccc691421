package com.tenacy.aiops.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 탐지 실행 한 번의 최종 상태. 부분 실패가 있어도 항상 생성된다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionReport {
    private int lineCount;
    private int windowCount;
    private List<Integer> anomalousWindows;
    private String summary;
    private List<NotificationResult> notifications;
    private RemediationOutcome remediation;
    private Instant startedAt;
    private Instant finishedAt;

    public int getAnomalyCount() {
        return anomalousWindows == null ? 0 : anomalousWindows.size();
    }
}
