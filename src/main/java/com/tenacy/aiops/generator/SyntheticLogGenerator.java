package com.tenacy.aiops.generator;

import com.tenacy.aiops.config.DetectorProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * 테스트/데모용 합성 로그 생성기. INFO 70%, WARN 20%, ERROR 10% 비율로
 * "app" 로거에 한 줄씩 기록한다 (logback-spring.xml의 롤링 파일).
 * <p>
 * 줄 사이 간격은 고정이 아니라 매번 [min-delay, max-delay] 구간에서 새로 뽑아 다시 예약한다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "aiops.generator", name = "enabled", havingValue = "true")
public class SyntheticLogGenerator {

    private static final Logger appLog = LoggerFactory.getLogger("app");

    static final List<String> ERROR_MESSAGES = List.of(
            "Failed to process item id=%d due to timeout",
            "Unhandled exception in worker id=%d: NullReference",
            "Disk quota exceeded for user id=%d"
    );

    static final List<String> WARN_MESSAGES = List.of(
            "High latency detected for endpoint /api/v1/items",
            "Retrying operation after transient failure id=%d",
            "Backpressure detected in pipeline stage %d"
    );

    static final List<String> INFO_MESSAGES = List.of(
            "Worker %d processed item id=%d in 120ms",
            "Scheduled maintenance job started",
            "Heartbeat OK for worker %d"
    );

    private final TaskScheduler taskScheduler;
    private final Duration minDelay;
    private final Duration maxDelay;
    private final Random random;

    @Autowired
    public SyntheticLogGenerator(TaskScheduler taskScheduler, DetectorProperties properties) {
        this(taskScheduler, properties.getGenerator().getMinDelay(), properties.getGenerator().getMaxDelay(),
                new Random());
    }

    SyntheticLogGenerator(TaskScheduler taskScheduler, Duration minDelay, Duration maxDelay, Random random) {
        this.taskScheduler = taskScheduler;
        this.minDelay = minDelay;
        this.maxDelay = maxDelay;
        this.random = random;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Synthetic log generator started - delay {} ~ {}", minDelay, maxDelay);
        scheduleNext();
    }

    void scheduleNext() {
        Duration delay = nextDelay();
        try {
            taskScheduler.schedule(this::emitAndReschedule, Instant.now().plus(delay));
        } catch (TaskRejectedException e) {
            // 컨텍스트 종료 중
            log.info("Synthetic log generator stopped: {}", e.getMessage());
        }
    }

    private void emitAndReschedule() {
        try {
            emit();
        } finally {
            scheduleNext();
        }
    }

    /**
     * [minDelay, maxDelay] 구간의 균등 분포 대기 시간.
     */
    Duration nextDelay() {
        long min = minDelay.toMillis();
        long span = maxDelay.toMillis() - min;
        if (span <= 0) {
            return Duration.ofMillis(min);
        }
        return Duration.ofMillis(min + (long) (random.nextDouble() * (span + 1)));
    }

    public void emit() {
        GeneratedLine line = generateLine();
        switch (line.getLevel()) {
            case "ERROR":
                appLog.error(line.getMessage());
                break;
            case "WARN":
                appLog.warn(line.getMessage());
                break;
            default:
                appLog.info(line.getMessage());
        }
    }

    public GeneratedLine generateLine() {
        double p = random.nextDouble();

        if (p < 0.7) {
            String template = pick(INFO_MESSAGES);
            return new GeneratedLine("INFO", String.format(template, randomWorker(), 1000 + random.nextInt(9000)));
        } else if (p < 0.9) {
            return new GeneratedLine("WARN", String.format(pick(WARN_MESSAGES), randomWorker()));
        }
        return new GeneratedLine("ERROR", String.format(pick(ERROR_MESSAGES), randomWorker()));
    }

    private String pick(List<String> templates) {
        return templates.get(random.nextInt(templates.size()));
    }

    private int randomWorker() {
        return 1 + random.nextInt(10);
    }

    @Getter
    @AllArgsConstructor
    public static class GeneratedLine {
        private final String level;
        private final String message;
    }
}
