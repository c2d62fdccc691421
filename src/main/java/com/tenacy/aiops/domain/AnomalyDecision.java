package com.tenacy.aiops.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class AnomalyDecision {

    private final String summary;  // 이상이 없으면 null
    private final List<NotificationResult> notifications;
    private final RemediationOutcome outcome;

    public static AnomalyDecision noAnomalies() {
        return new AnomalyDecision(null, Collections.emptyList(), RemediationOutcome.none());
    }

    public boolean hasSummary() {
        return summary != null;
    }
}
