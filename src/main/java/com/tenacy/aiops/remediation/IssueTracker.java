package com.tenacy.aiops.remediation;

import com.tenacy.aiops.domain.IssueCreationResult;

public interface IssueTracker {

    /**
     * 자격 증명과 대상 저장소가 모두 설정되어 있는지 여부.
     */
    boolean isConfigured();

    IssueCreationResult createIssue(String title, String body);
}
