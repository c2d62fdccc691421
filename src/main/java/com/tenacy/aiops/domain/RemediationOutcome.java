package com.tenacy.aiops.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RemediationOutcome {

    private final RemediationKind kind;
    private final String locator;  // 이슈 URL 또는 기록 파일 경로, NONE이면 null

    public static RemediationOutcome issueCreated(String url) {
        return new RemediationOutcome(RemediationKind.ISSUE_CREATED, url);
    }

    public static RemediationOutcome logAppended(String path) {
        return new RemediationOutcome(RemediationKind.LOG_APPENDED, path);
    }

    public static RemediationOutcome none() {
        return new RemediationOutcome(RemediationKind.NONE, null);
    }
}
