package com.tenacy.aiops.remediation;

import com.tenacy.aiops.domain.IssueCreationResult;
import com.tenacy.aiops.domain.RemediationKind;
import com.tenacy.aiops.domain.RemediationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 자동 조치 정책.
 * <ol>
 *     <li>이슈 트래커가 설정되어 있으면 이슈 생성</li>
 *     <li>미설정이거나 실패하면 로컬 기록 파일에 추가</li>
 *     <li>기록도 실패하면 NONE (예외를 던지지 않음)</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemediationService {

    static final String ISSUE_TITLE = "AI-Ops: Anomaly detected \u2014 auto remediation";

    private final IssueTracker issueTracker;
    private final RemediationRecordWriter recordWriter;

    public RemediationOutcome remediate(String summary) {
        if (issueTracker.isConfigured()) {
            IssueCreationResult result = issueTracker.createIssue(ISSUE_TITLE, summary);
            if (result.isCreated()) {
                return RemediationOutcome.issueCreated(result.getUrl());
            }
            log.warn("Issue creation failed ({}), falling back to remediation log", result.getError());
        }

        RemediationOutcome outcome = recordWriter.append(summary);
        if (outcome.getKind() == RemediationKind.NONE) {
            log.error("Remediation failed: no issue created and remediation log not written");
        }
        return outcome;
    }
}
