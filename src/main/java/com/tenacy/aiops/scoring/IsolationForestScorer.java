package com.tenacy.aiops.scoring;

import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.AnomalyLabel;
import com.tenacy.aiops.domain.FeatureMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 배치마다 새로 학습하는 isolation forest 기반 스코어러.
 * <p>
 * 판정 임계값은 학습 배치의 음의 이상 점수 분포에서 {@code 100 * contamination} 백분위수이며,
 * 그보다 엄격히 작은 행만 이상으로 표시한다. 같은 시드와 같은 입력이면 항상 같은 결과를 낸다.
 */
@Slf4j
@Component
public class IsolationForestScorer implements OutlierScorer {

    // 이 미만의 배치는 통계적 의미가 없으므로 항상 정상으로 본다
    public static final int MIN_SAMPLES = 3;

    private final long seed;
    private final int treeCount;
    private final int maxSamples;

    @Autowired
    public IsolationForestScorer(DetectorProperties properties) {
        this(properties.getDetector().getRandomSeed(),
                properties.getDetector().getTreeCount(),
                properties.getDetector().getMaxSamples());
    }

    public IsolationForestScorer(long seed, int treeCount, int maxSamples) {
        this.seed = seed;
        this.treeCount = treeCount;
        this.maxSamples = maxSamples;
    }

    @Override
    public Set<Integer> score(FeatureMatrix features, double contamination) {
        Set<Integer> anomalies = new HashSet<>();
        for (AnomalyLabel label : label(features, contamination)) {
            if (label.isAnomalous()) {
                anomalies.add(label.getWindowIndex());
            }
        }
        return Collections.unmodifiableSet(anomalies);
    }

    /**
     * 행마다 정상/이상 라벨을 붙인다. 라벨 순서는 입력 행 순서와 같다.
     */
    public List<AnomalyLabel> label(FeatureMatrix features, double contamination) {
        List<AnomalyLabel> labels = new ArrayList<>(features.rowCount());
        // 표본 부족이면 contamination 값과 무관하게 모두 정상
        if (features.rowCount() < MIN_SAMPLES) {
            log.debug("Only {} feature rows, skipping outlier model", features.rowCount());
            for (int i = 0; i < features.rowCount(); i++) {
                labels.add(new AnomalyLabel(i, false, 0.0));
            }
            return labels;
        }

        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5]: " + contamination);
        }

        double[][] data = features.toArray();
        IsolationForest forest = IsolationForest.fit(data, treeCount, maxSamples, new Random(seed));
        double[] scores = forest.scoreSamples(data);

        double[] negated = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            negated[i] = -scores[i];
        }
        double offset = percentile(negated, 100.0 * contamination);

        for (int i = 0; i < scores.length; i++) {
            labels.add(new AnomalyLabel(i, negated[i] < offset, scores[i]));
        }

        log.debug("Isolation forest fitted - rows: {}, trees: {}, subsample: {}, offset: {}",
                data.length, forest.getTreeCount(), forest.getSubsampleSize(), offset);
        return labels;
    }

    /**
     * 선형 보간 백분위수.
     */
    static double percentile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
