package com.tenacy.aiops.window;

import com.tenacy.aiops.domain.LogLine;
import com.tenacy.aiops.domain.Window;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 정렬된 로그 라인을 고정 길이 슬라이딩 윈도우로 자른다.
 * <p>
 * 윈도우 시작점은 {@code 0, step, 2*step, ...} 중 {@code max(1, N - size + 1)} 미만인 값이다.
 * 남은 라인이 size보다 적으면 마지막 윈도우는 잘린 채로 생성된다.
 * 입력이 타임스탬프 순이 아니어도 예외 없이 인덱스 기준으로 자른다.
 */
@Getter
public class WindowBuilder {

    private final int size;
    private final int step;

    public WindowBuilder(int size, int step) {
        if (size <= 0) {
            throw new IllegalArgumentException("window size must be > 0: " + size);
        }
        if (step <= 0) {
            throw new IllegalArgumentException("window step must be > 0: " + step);
        }
        this.size = size;
        this.step = step;
    }

    public List<Window> build(List<LogLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return Collections.emptyList();
        }

        int n = lines.size();
        int limit = Math.max(1, n - size + 1);
        List<Window> windows = new ArrayList<>(expectedCount(n));

        for (int start = 0; start < limit; start += step) {
            int end = Math.min(start + size, n);
            windows.add(new Window(start, new ArrayList<>(lines.subList(start, end))));
        }
        return windows;
    }

    /**
     * N개 라인에 대해 생성될 윈도우 수.
     */
    public int expectedCount(int lineCount) {
        if (lineCount <= 0) {
            return 0;
        }
        return Math.max(1, Math.floorDiv(lineCount - size, step) + 1);
    }
}
