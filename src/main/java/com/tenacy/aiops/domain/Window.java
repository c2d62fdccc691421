package com.tenacy.aiops.domain;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 로그 라인 시퀀스의 연속 구간. 슬라이딩 간격에 따라 다른 윈도우와 겹칠 수 있다.
 */
@Getter
@ToString
public class Window {

    private final int startIndex;
    private final List<LogLine> lines;

    public Window(int startIndex, List<LogLine> lines) {
        this.startIndex = startIndex;
        this.lines = Collections.unmodifiableList(lines);
    }

    public int getLength() {
        return lines.size();
    }
}
