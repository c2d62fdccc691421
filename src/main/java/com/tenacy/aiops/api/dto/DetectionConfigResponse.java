package com.tenacy.aiops.api.dto;

import com.tenacy.aiops.config.DetectorProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionConfigResponse {
    private Integer rangeMinutes;
    private Integer windowSize;
    private Integer windowStep;
    private Double contamination;
    private Long randomSeed;
    private Boolean slackConfigured;
    private Boolean issueTrackerConfigured;
    private String remediationRecordPath;

    public static DetectionConfigResponse of(DetectorProperties properties) {
        DetectorProperties.Detector detector = properties.getDetector();
        return DetectionConfigResponse.builder()
                .rangeMinutes(detector.getRangeMinutes())
                .windowSize(detector.getWindowSize())
                .windowStep(detector.getWindowStep())
                .contamination(detector.getContamination())
                .randomSeed(detector.getRandomSeed())
                .slackConfigured(properties.getAlert().getSlack().isConfigured())
                .issueTrackerConfigured(properties.getRemediation().getGithub().isConfigured())
                .remediationRecordPath(properties.getRemediation().getRecordPath())
                .build();
    }
}
