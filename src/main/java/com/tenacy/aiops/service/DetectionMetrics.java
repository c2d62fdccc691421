package com.tenacy.aiops.service;

import com.tenacy.aiops.domain.DetectionReport;
import com.tenacy.aiops.domain.NotificationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class DetectionMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter runsCounter;
    private final Counter windowsCounter;
    private final Counter anomaliesCounter;
    private final Counter notificationFailuresCounter;
    private final Timer runTimer;

    private final AtomicInteger lastAnomalyCountGauge = new AtomicInteger(0);

    public DetectionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsCounter = Counter.builder("aiops.detection.runs")
                .description("Number of detection runs")
                .register(meterRegistry);

        this.windowsCounter = Counter.builder("aiops.detection.windows")
                .description("Number of windows scored")
                .register(meterRegistry);

        this.anomaliesCounter = Counter.builder("aiops.detection.anomalies")
                .description("Number of anomalous windows detected")
                .register(meterRegistry);

        this.notificationFailuresCounter = Counter.builder("aiops.notification.failures")
                .description("Number of alert deliveries that failed")
                .register(meterRegistry);

        this.runTimer = Timer.builder("aiops.detection.duration")
                .description("Detection run duration")
                .register(meterRegistry);

        meterRegistry.gauge("aiops.detection.last.anomalies", lastAnomalyCountGauge);
    }

    public Timer.Sample startRun() {
        return Timer.start(meterRegistry);
    }

    public void recordRun(DetectionReport report, Timer.Sample sample) {
        sample.stop(runTimer);
        runsCounter.increment();
        windowsCounter.increment(report.getWindowCount());
        anomaliesCounter.increment(report.getAnomalyCount());
        lastAnomalyCountGauge.set(report.getAnomalyCount());

        if (report.getNotifications() != null) {
            for (NotificationResult result : report.getNotifications()) {
                if (result.getStatus() == NotificationResult.Status.FAILED) {
                    notificationFailuresCounter.increment();
                }
            }
        }

        if (report.getAnomalyCount() > 0 && report.getRemediation() != null) {
            meterRegistry.counter("aiops.remediation.outcome",
                    "kind", report.getRemediation().getKind().name()).increment();
        }
    }
}
