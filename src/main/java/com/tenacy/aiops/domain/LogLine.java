package com.tenacy.aiops.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class LogLine {
    Instant timestamp;
    String text;

    public static LogLine of(Instant timestamp, String text) {
        return new LogLine(timestamp, text);
    }
}
