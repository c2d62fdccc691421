package com.tenacy.aiops.scoring;

import com.tenacy.aiops.domain.FeatureMatrix;

import java.util.Set;

public interface OutlierScorer {

    /**
     * 배치 전체에 대해 새로 학습하고 이상치로 판정된 행 인덱스를 반환한다.
     * 반환 집합의 순회 순서는 보장하지 않는다.
     *
     * @param features      윈도우 순서의 특징 행렬
     * @param contamination 예상 이상치 비율, (0, 0.5]
     */
    Set<Integer> score(FeatureMatrix features, double contamination);
}
