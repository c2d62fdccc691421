package com.tenacy.aiops.domain;

import lombok.Builder;
import lombok.Value;

/**
 * 윈도우 하나의 수치 요약.
 * <p>
 * 필드 순서(avgLength, errorCount, warnCount, uniqueCount)는 스코어러와 요약 포맷이
 * 위치 기반으로 참조하므로 변경하면 안 된다.
 */
@Value
@Builder
public class FeatureVector {

    public static final int ARITY = 4;

    double avgLength;
    int errorCount;
    int warnCount;
    int uniqueCount;

    public double[] toArray() {
        return new double[]{avgLength, errorCount, warnCount, uniqueCount};
    }
}
