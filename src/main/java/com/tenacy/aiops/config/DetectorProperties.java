package com.tenacy.aiops.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Paths;
import java.time.Duration;

/**
 * 탐지기 설정. 기동 시 한 번 바인딩/검증되고 이후 모든 컴포넌트가 같은 값을 공유한다.
 * <p>
 * 잘못된 값(윈도우 크기/간격 0 이하, contamination 범위 밖)은 I/O 이전에 기동을 실패시킨다.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "aiops")
public class DetectorProperties {

    @Valid
    private final Detector detector = new Detector();

    @Valid
    private final Loki loki = new Loki();

    @Valid
    private final Alert alert = new Alert();

    @Valid
    private final Remediation remediation = new Remediation();

    @Valid
    private final Generator generator = new Generator();

    @Data
    public static class Detector {
        @Positive
        private int rangeMinutes = 10;

        @Positive
        private int windowSize = 50;

        @Positive
        private int windowStep = 25;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "0.5")
        private double contamination = 0.05;

        private long randomSeed = 42L;

        @Positive
        private int treeCount = 100;

        @Positive
        private int maxSamples = 256;

        private boolean parallelExtraction = true;

        private boolean runOnStartup = true;

        @Valid
        private final Schedule schedule = new Schedule();
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;

        @NotNull
        private Duration interval = Duration.ofMinutes(5);
    }

    @Data
    public static class Loki {
        @NotBlank
        private String url = "http://loki:3100";

        @NotBlank
        private String query = "{job=\"app\"}";

        @Positive
        private int limit = 1000;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Alert {
        private final Slack slack = new Slack();
        private final Email email = new Email();
    }

    @Data
    public static class Slack {
        private String webhookUrl;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isConfigured() {
            return StringUtils.hasText(webhookUrl);
        }
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String sender;
        private String recipients;
    }

    @Data
    public static class Remediation {
        @NotBlank
        private String recordPath = "/tmp/remediation.log";

        @Valid
        private final Github github = new Github();
    }

    @Data
    public static class Github {
        private String token;
        private String repository;

        @NotBlank
        private String apiUrl = "https://api.github.com";

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isConfigured() {
            return StringUtils.hasText(token) && StringUtils.hasText(repository);
        }
    }

    @Data
    public static class Generator {
        private boolean enabled = false;

        // 줄 사이 대기 시간은 [minDelay, maxDelay] 에서 균등 추출
        @NotNull
        private Duration minDelay = Duration.ofMillis(500);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(2);

        private String logFile = Paths.get(System.getProperty("java.io.tmpdir"), "aiops", "app.log").toString();

        @AssertTrue(message = "min-delay must not be negative or greater than max-delay")
        public boolean isDelayRangeValid() {
            return minDelay == null || maxDelay == null
                    || (!minDelay.isNegative() && minDelay.compareTo(maxDelay) <= 0);
        }
    }
}
