package com.vehicle.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeSessionCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeSessionCount = registry.gauge("telemetry.sessions.active", new AtomicInteger(0));
    }

    public void recordDetection(int anomalyCount) {
        Counter.builder("telemetry.detection.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("telemetry.detection.anomalies")
                .register(registry)
                .record(anomalyCount);
    }

    public void recordAnomaly(String anomalyType, String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("anomaly_type", anomalyType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String anomalyType) {
        Counter.builder("detector.failure.count")
                .tag("anomaly_type", anomalyType)
                .register(registry)
                .increment();
    }

    public void recordModelFailure(String modelName, String reason) {
        Counter.builder("detector.model.failure.count")
                .tag("model", modelName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordProfileLookupFailure() {
        Counter.builder("profile.lookup.failure.count")
                .register(registry)
                .increment();
    }

    public void recordPersistence(String status) {
        Counter.builder("anomaly.persist.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSessionsEvicted(int count) {
        Counter.builder("telemetry.sessions.evicted.count")
                .register(registry)
                .increment(count);
    }

    public void updateActiveSessionCount(int count) {
        activeSessionCount.set(count);
    }
}
