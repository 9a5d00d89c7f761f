package com.vehicle.anomaly.service;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.engine.AnomalyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Service
public class SessionCleanupService {

    private static final Logger log = LoggerFactory.getLogger(SessionCleanupService.class);

    private final AnomalyEngine engine;
    private final DetectionConfig config;

    public SessionCleanupService(AnomalyEngine engine, DetectionConfig config) {
        this.engine = engine;
        this.config = config;
    }

    @Scheduled(fixedRateString = "${telemetry.detection.history.cleanup-interval-minutes:30}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${telemetry.detection.history.cleanup-interval-minutes:30}")
    public void sweepStaleSessions() {
        Duration ttl = Duration.ofHours(config.getHistory().getSessionTtlHours());
        int removed = engine.cleanupStaleSessions(ttl);
        log.debug("Session sweep done: {} removed, {} active", removed, engine.getActiveSessionCount());
    }
}
