package com.tenacy.aiops.domain;

public enum RemediationKind {
    ISSUE_CREATED,
    LOG_APPENDED,
    NONE
}
