package com.tenacy.aiops.config;

import com.tenacy.aiops.window.WindowBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Paths;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class DetectorPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(DetectorConfig.class);

    @Test
    @DisplayName("설정 - 기본값 바인딩")
    void defaults_ShouldBindWithoutOverrides() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(WindowBuilder.class);

            DetectorProperties properties = context.getBean(DetectorProperties.class);
            assertThat(properties.getDetector().getRangeMinutes()).isEqualTo(10);
            assertThat(properties.getDetector().getWindowSize()).isEqualTo(50);
            assertThat(properties.getDetector().getWindowStep()).isEqualTo(25);
            assertThat(properties.getDetector().getContamination()).isEqualTo(0.05);
            assertThat(properties.getLoki().getUrl()).isEqualTo("http://loki:3100");
            assertThat(properties.getAlert().getSlack().isConfigured()).isFalse();
            assertThat(properties.getRemediation().getGithub().isConfigured()).isFalse();
            assertThat(properties.getRemediation().getRecordPath()).isEqualTo("/tmp/remediation.log");
        });
    }

    @Test
    @DisplayName("설정 - 환경별 값 덮어쓰기")
    void overrides_ShouldBindNestedProperties() {
        contextRunner
                .withPropertyValues(
                        "aiops.detector.window-size=20",
                        "aiops.detector.window-step=10",
                        "aiops.detector.contamination=0.5",
                        "aiops.detector.schedule.interval=30s",
                        "aiops.alert.slack.webhook-url=https://hooks.slack.com/services/T000/B000/XXX",
                        "aiops.remediation.github.token=ghp_secret",
                        "aiops.remediation.github.repository=acme/shop")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    DetectorProperties properties = context.getBean(DetectorProperties.class);
                    assertThat(properties.getDetector().getWindowSize()).isEqualTo(20);
                    assertThat(properties.getDetector().getContamination()).isEqualTo(0.5);
                    assertThat(properties.getDetector().getSchedule().getInterval()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(properties.getAlert().getSlack().isConfigured()).isTrue();
                    assertThat(properties.getRemediation().getGithub().isConfigured()).isTrue();
                });
    }

    @Test
    @DisplayName("설정 - contamination 범위 밖이면 기동 실패")
    void contaminationOutOfRange_ShouldFailStartup() {
        contextRunner.withPropertyValues("aiops.detector.contamination=0.75")
                .run(context -> assertThat(context).hasFailed());

        contextRunner.withPropertyValues("aiops.detector.contamination=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("설정 - 윈도우 크기/간격이 0 이하면 기동 실패")
    void nonPositiveWindowParameters_ShouldFailStartup() {
        contextRunner.withPropertyValues("aiops.detector.window-size=0")
                .run(context -> assertThat(context).hasFailed());

        contextRunner.withPropertyValues("aiops.detector.window-step=-1")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("설정 - 합성 로그 대기 구간 기본값과 역전된 구간 거부")
    void generatorDelayRange_ShouldDefaultAndRejectInvertedRange() {
        contextRunner.run(context -> {
            DetectorProperties.Generator generator = context.getBean(DetectorProperties.class).getGenerator();
            assertThat(generator.isEnabled()).isFalse();
            assertThat(generator.getMinDelay()).isEqualTo(Duration.ofMillis(500));
            assertThat(generator.getMaxDelay()).isEqualTo(Duration.ofSeconds(2));
        });

        contextRunner.withPropertyValues("aiops.generator.min-delay=3s", "aiops.generator.max-delay=1s")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("설정 - 합성 로그 파일 기본 경로는 쓰기 가능한 임시 디렉토리")
    void generatorLogFile_ShouldDefaultUnderTempDirectory() {
        contextRunner.run(context -> {
            String logFile = context.getBean(DetectorProperties.class).getGenerator().getLogFile();
            assertThat(Paths.get(logFile))
                    .isEqualTo(Paths.get(System.getProperty("java.io.tmpdir"), "aiops", "app.log"));
        });

        contextRunner.withPropertyValues("aiops.generator.log-file=/var/log/app/app.log")
                .run(context -> assertThat(context.getBean(DetectorProperties.class).getGenerator().getLogFile())
                        .isEqualTo("/var/log/app/app.log"));
    }
}
