package com.tenacy.aiops.api;

import com.tenacy.aiops.api.dto.DetectionConfigResponse;
import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.DetectionReport;
import com.tenacy.aiops.service.DetectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/detections")
@RequiredArgsConstructor
public class DetectionController {

    private final DetectionService detectionService;
    private final DetectorProperties properties;

    // 탐지 1회 실행
    @PostMapping
    public ResponseEntity<DetectionReport> runDetection() {
        return ResponseEntity.ok(detectionService.runDetection());
    }

    @GetMapping("/config")
    public ResponseEntity<DetectionConfigResponse> getConfig() {
        return ResponseEntity.ok(DetectionConfigResponse.of(properties));
    }
}
