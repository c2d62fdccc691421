package com.tenacy.aiops.service;

import com.tenacy.aiops.domain.NotificationResult;

public interface AlertService {

    String getChannel();

    /**
     * 알림 한 건을 전송한다. 실패는 예외가 아니라 결과로 돌려준다.
     */
    NotificationResult sendAlert(String subject, String message);
}
