package com.tenacy.aiops.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IssueCreationResult {

    private final boolean created;
    private final String url;
    private final String error;

    public static IssueCreationResult created(String url) {
        return new IssueCreationResult(true, url, null);
    }

    public static IssueCreationResult failed(String error) {
        return new IssueCreationResult(false, null, error);
    }
}
