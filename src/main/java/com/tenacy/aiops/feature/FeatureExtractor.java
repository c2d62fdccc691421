package com.tenacy.aiops.feature;

import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.FeatureMatrix;
import com.tenacy.aiops.domain.FeatureVector;
import com.tenacy.aiops.domain.LogLine;
import com.tenacy.aiops.domain.Window;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 윈도우별 특징 벡터 추출.
 * <p>
 * 마커 매칭은 대소문자를 구분하는 단순 부분 문자열 포함 여부로 판단한다.
 * 한 라인이 두 마커를 모두 포함해도 한 번만 센다.
 */
@Slf4j
@Component
public class FeatureExtractor {

    static final String[] ERROR_MARKERS = {"ERROR", "Error"};
    static final String[] WARN_MARKERS = {"WARN", "Warning"};

    private final Executor executor;
    private final boolean parallel;

    public FeatureExtractor(@Qualifier("featureExtractionExecutor") Executor executor,
                            DetectorProperties properties) {
        this.executor = executor;
        this.parallel = properties.getDetector().isParallelExtraction();
    }

    public FeatureVector extract(Window window) {
        List<LogLine> lines = window.getLines();
        if (lines.isEmpty()) {
            return FeatureVector.builder().avgLength(0.0).build();
        }

        long totalLength = 0;
        int errorCount = 0;
        int warnCount = 0;
        Set<String> uniqueTexts = new HashSet<>();

        for (LogLine line : lines) {
            String text = line.getText() != null ? line.getText() : "";
            totalLength += text.length();
            if (containsAny(text, ERROR_MARKERS)) {
                errorCount++;
            }
            if (containsAny(text, WARN_MARKERS)) {
                warnCount++;
            }
            uniqueTexts.add(text);
        }

        return FeatureVector.builder()
                .avgLength((double) totalLength / lines.size())
                .errorCount(errorCount)
                .warnCount(warnCount)
                .uniqueCount(uniqueTexts.size())
                .build();
    }

    /**
     * 모든 윈도우의 특징 행렬. 행 순서는 입력 윈도우 순서와 같다.
     */
    public FeatureMatrix extractAll(List<Window> windows) {
        if (windows == null || windows.isEmpty()) {
            return FeatureMatrix.empty();
        }

        if (!parallel || windows.size() == 1) {
            List<FeatureVector> rows = new ArrayList<>(windows.size());
            for (Window window : windows) {
                rows.add(extract(window));
            }
            return new FeatureMatrix(rows);
        }

        List<CompletableFuture<FeatureVector>> futures = windows.stream()
                .map(window -> CompletableFuture.supplyAsync(() -> extract(window), executor))
                .collect(Collectors.toList());

        List<FeatureVector> rows = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        log.debug("Extracted {} feature rows in parallel", rows.size());
        return new FeatureMatrix(rows);
    }

    private static boolean containsAny(String text, String[] markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
