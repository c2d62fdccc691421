package com.tenacy.aiops.service;

import com.tenacy.aiops.domain.AnomalyDecision;
import com.tenacy.aiops.domain.FeatureMatrix;
import com.tenacy.aiops.domain.FeatureVector;
import com.tenacy.aiops.domain.NotificationResult;
import com.tenacy.aiops.domain.RemediationKind;
import com.tenacy.aiops.domain.RemediationOutcome;
import com.tenacy.aiops.remediation.RemediationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class DecisionOrchestratorTest {

    @Mock
    private NotificationService notificationService;

    @Mock
    private RemediationService remediationService;

    @InjectMocks
    private DecisionOrchestrator decisionOrchestrator;

    private FeatureMatrix features;

    @BeforeEach
    void setUp() {
        features = new FeatureMatrix(List.of(
                FeatureVector.builder().avgLength(32.44).errorCount(20).warnCount(0).uniqueCount(25).build(),
                FeatureVector.builder().avgLength(30.0).errorCount(0).warnCount(1).uniqueCount(5).build(),
                FeatureVector.builder().avgLength(41.96).errorCount(3).warnCount(7).uniqueCount(12).build()
        ));
    }

    @Test
    @DisplayName("요약 - 인덱스 오름차순, 평균 길이는 소수 첫째 자리")
    void summarize_ShouldFormatSortedLines() {
        // given
        Set<Integer> anomalies = new LinkedHashSet<>(List.of(2, 0));

        // when
        String summary = decisionOrchestrator.summarize(anomalies, features);

        // then
        assertEquals("window#0: avg_len=32.4, errors=20, warns=0, uniq=25\n" +
                "window#2: avg_len=42.0, errors=3, warns=7, uniq=12", summary);
    }

    @Test
    @DisplayName("판단 - 이상이 없으면 알림/조치 없음")
    void decide_ShouldDoNothingWithoutAnomalies() {
        // when
        AnomalyDecision decision = decisionOrchestrator.decide(Collections.emptySet(), features);

        // then
        assertFalse(decision.hasSummary());
        assertEquals(RemediationKind.NONE, decision.getOutcome().getKind());
        assertTrue(decision.getNotifications().isEmpty());
        verifyNoInteractions(notificationService, remediationService);
    }

    @Test
    @DisplayName("판단 - 알림 후 조치 순서로 호출")
    void decide_ShouldNotifyBeforeRemediating() {
        // given
        when(notificationService.notify(anyString(), anyString()))
                .thenReturn(List.of(NotificationResult.delivered("slack")));
        when(remediationService.remediate(anyString()))
                .thenReturn(RemediationOutcome.logAppended("/tmp/remediation.log"));

        // when
        AnomalyDecision decision = decisionOrchestrator.decide(Set.of(1), features);

        // then
        String expectedSummary = "window#1: avg_len=30.0, errors=0, warns=1, uniq=5";
        assertEquals(expectedSummary, decision.getSummary());
        assertEquals(RemediationKind.LOG_APPENDED, decision.getOutcome().getKind());

        InOrder inOrder = inOrder(notificationService, remediationService);
        inOrder.verify(notificationService).notify(eq(DecisionOrchestrator.ALERT_SUBJECT), eq(expectedSummary));
        inOrder.verify(remediationService).remediate(expectedSummary);
    }

    @Test
    @DisplayName("판단 - 알림 실패해도 조치는 수행")
    void decide_ShouldRemediateEvenIfNotificationFails() {
        // given
        when(notificationService.notify(anyString(), anyString()))
                .thenReturn(List.of(NotificationResult.failed("slack", "503 Service Unavailable")));
        when(remediationService.remediate(anyString()))
                .thenReturn(RemediationOutcome.issueCreated("https://github.com/acme/shop/issues/3"));

        // when
        AnomalyDecision decision = decisionOrchestrator.decide(Set.of(0, 2), features);

        // then
        assertEquals(RemediationKind.ISSUE_CREATED, decision.getOutcome().getKind());
        assertEquals("https://github.com/acme/shop/issues/3", decision.getOutcome().getLocator());
        assertFalse(decision.getNotifications().get(0).isDelivered());
        verify(remediationService, times(1)).remediate(anyString());
    }
}
