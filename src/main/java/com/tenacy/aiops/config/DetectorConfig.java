package com.tenacy.aiops.config;

import com.tenacy.aiops.window.WindowBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(DetectorProperties.class)
public class DetectorConfig {

    @Bean
    public WindowBuilder windowBuilder(DetectorProperties properties) {
        DetectorProperties.Detector detector = properties.getDetector();
        log.info("Detector configured - range: {}m, window size: {}, step: {}, contamination: {}",
                detector.getRangeMinutes(), detector.getWindowSize(),
                detector.getWindowStep(), detector.getContamination());
        return new WindowBuilder(detector.getWindowSize(), detector.getWindowStep());
    }
}
