package com.tenacy.aiops.remediation;

import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.RemediationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;

/**
 * 로컬 조치 기록 파일. 한 줄에 {@code <timestamp> - <summary>} 형식으로 추가만 한다.
 * 동시 실행 간 잠금은 하지 않는다.
 */
@Slf4j
@Component
public class RemediationRecordWriter {

    private final Path recordPath;
    private final Clock clock;

    @Autowired
    public RemediationRecordWriter(DetectorProperties properties) {
        this(Paths.get(properties.getRemediation().getRecordPath()), Clock.systemUTC());
    }

    RemediationRecordWriter(Path recordPath, Clock clock) {
        this.recordPath = recordPath;
        this.clock = clock;
    }

    public RemediationOutcome append(String summary) {
        // 여러 윈도우 요약도 한 항목 = 한 줄
        String flattened = summary.replace("\r\n", " | ").replace("\n", " | ");
        String entry = Instant.now(clock) + " - " + flattened + System.lineSeparator();

        try {
            Path parent = recordPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
                log.info("조치 기록 디렉토리 생성: {}", parent);
            }

            Files.writeString(recordPath, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            log.info("Wrote remediation log to {}", recordPath);
            return RemediationOutcome.logAppended(recordPath.toString());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write remediation log {}: {}", recordPath, e.getMessage(), e);
            return RemediationOutcome.none();
        }
    }

    public Path getRecordPath() {
        return recordPath;
    }
}
