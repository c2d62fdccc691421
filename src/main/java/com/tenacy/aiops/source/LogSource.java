package com.tenacy.aiops.source;

import com.tenacy.aiops.domain.LogLine;

import java.time.Duration;
import java.util.List;

public interface LogSource {

    /**
     * 최근 {@code range} 동안의 로그 라인을 타임스탬프 순으로 반환한다.
     * 조회 실패 시 예외 대신 빈 목록을 반환한다.
     */
    List<LogLine> fetchRecent(Duration range);
}
