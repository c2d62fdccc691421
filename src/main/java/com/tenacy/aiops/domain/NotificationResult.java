package com.tenacy.aiops.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 알림 채널 하나의 전송 결과.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NotificationResult {

    public enum Status {
        DELIVERED,
        SKIPPED,
        FAILED
    }

    private final String channel;
    private final Status status;
    private final String detail;

    public static NotificationResult delivered(String channel) {
        return new NotificationResult(channel, Status.DELIVERED, null);
    }

    public static NotificationResult skipped(String channel, String reason) {
        return new NotificationResult(channel, Status.SKIPPED, reason);
    }

    public static NotificationResult failed(String channel, String error) {
        return new NotificationResult(channel, Status.FAILED, error);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
