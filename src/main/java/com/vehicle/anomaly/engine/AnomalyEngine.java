package com.vehicle.anomaly.engine;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.config.MetricsConfig;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.HistoryEntry;
import com.vehicle.anomaly.model.TelemetrySample;
import com.vehicle.anomaly.model.VehicleBaselineProfile;
import com.vehicle.anomaly.repository.VehicleProfileRepository;
import com.vehicle.anomaly.service.AnomalyPersistenceService;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the detection pipeline.
 *
 * Flow of {@link #detect}:
 * 1. Append the sample to the session buffer and snapshot it
 * 2. Look up the vehicle baseline (only when a vehicle id is given)
 * 3. Run every registered detector, in {@link AnomalyType} order, on the snapshot
 * 4. Concatenate the results
 * 5. Hand them to the persistence service (asynchronous, best effort)
 *
 * A detector that throws is reported as a failed outcome and never aborts the call.
 */
@Component
public class AnomalyEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEngine.class);

    private final Map<AnomalyType, AnomalyDetector> detectorMap;
    private final SessionHistoryStore historyStore;
    private final VehicleProfileRepository profileRepository;
    private final AnomalyPersistenceService persistenceService;
    private final Clock clock;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AnomalyEngine(List<AnomalyDetector> detectors,
                         VehicleProfileRepository profileRepository,
                         AnomalyPersistenceService persistenceService,
                         DetectionConfig config,
                         Clock clock,
                         Tracer tracer,
                         MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(AnomalyType.class);
        this.historyStore = new SessionHistoryStore(config.getHistory().getBufferSize());
        this.profileRepository = profileRepository;
        this.persistenceService = persistenceService;
        this.clock = clock;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (AnomalyDetector detector : detectors) {
            AnomalyDetector previous = detectorMap.put(detector.getAnomalyType(), detector);
            if (previous != null) {
                throw new IllegalStateException("Two detectors registered for " + detector.getAnomalyType()
                        + ": " + previous.getClass().getSimpleName()
                        + " and " + detector.getClass().getSimpleName());
            }
            log.info("Registered detector: {} -> {}",
                    detector.getAnomalyType(), detector.getClass().getSimpleName());
        }
    }

    public List<AnomalyResult> detect(Map<String, ? extends Number> readings, String sessionId, String vehicleId) {
        Objects.requireNonNull(readings, "readings");
        return detect(TelemetrySample.of(readings), sessionId, vehicleId);
    }

    /**
     * Run all detectors on one sample of a session.
     *
     * @param vehicleId may be null; the baseline comparison is skipped then
     * @return every anomaly found, grouped by detector in {@link AnomalyType} order
     */
    @Observed(name = "telemetry.detect", contextualName = "detect-anomalies")
    public List<AnomalyResult> detect(TelemetrySample sample, String sessionId, String vehicleId) {
        Objects.requireNonNull(sample, "sample");
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }

        Instant now = clock.instant();
        List<HistoryEntry> history = historyStore.append(sessionId, sample, now);

        DetectionContext context = DetectionContext.builder()
                .sessionId(sessionId)
                .vehicleId(vehicleId)
                .sample(sample)
                .timestamp(now)
                .history(history)
                .profile(lookupProfile(vehicleId))
                .build();

        List<AnomalyResult> anomalies = new ArrayList<>();
        for (DetectorOutcome outcome : evaluate(context)) {
            anomalies.addAll(outcome.getAnomalies());
        }

        metricsConfig.recordDetection(anomalies.size());
        metricsConfig.updateActiveSessionCount(historyStore.sessionCount());
        for (AnomalyResult anomaly : anomalies) {
            metricsConfig.recordAnomaly(anomaly.getAnomalyType().code(), anomaly.getSeverity().code());
        }
        if (!anomalies.isEmpty()) {
            log.info("Session {} vehicle {}: {} anomalies detected", sessionId, vehicleId, anomalies.size());
        }

        try {
            // The persistence task runs on another thread; it gets its own immutable copy
            persistenceService.persistAll(sessionId, vehicleId, List.copyOf(anomalies));
        } catch (Exception e) {
            // Persistence is best effort; the caller still gets the results
            log.error("Failed to hand off {} anomalies of session {} for persistence: {}",
                    anomalies.size(), sessionId, e.getMessage(), e);
        }
        return anomalies;
    }

    /**
     * Run the detectors on an explicit snapshot. Touches neither the session
     * buffers nor the store, so the same context always gives the same outcomes.
     */
    public List<DetectorOutcome> evaluate(DetectionContext context) {
        List<DetectorOutcome> outcomes = new ArrayList<>(detectorMap.size());
        for (AnomalyDetector detector : detectorMap.values()) {
            outcomes.add(runDetector(detector, context));
        }
        return outcomes;
    }

    /**
     * Drop every session whose newest sample is older than {@code maxAge}.
     *
     * @return number of sessions removed
     */
    public int cleanupStaleSessions(Duration maxAge) {
        int removed = historyStore.evictStale(maxAge, clock.instant());
        metricsConfig.recordSessionsEvicted(removed);
        metricsConfig.updateActiveSessionCount(historyStore.sessionCount());
        if (removed > 0) {
            log.info("Removed {} stale sessions older than {}, {} remain",
                    removed, maxAge, historyStore.sessionCount());
        }
        return removed;
    }

    public List<HistoryEntry> getSessionHistory(String sessionId) {
        return historyStore.snapshot(sessionId);
    }

    public int getActiveSessionCount() {
        return historyStore.sessionCount();
    }

    private DetectorOutcome runDetector(AnomalyDetector detector, DetectionContext context) {
        AnomalyType type = detector.getAnomalyType();
        Span span = tracer.nextSpan()
                .name("detector.run." + type.code())
                .tag("detector.type", type.name())
                .tag("session.id", context.getSessionId())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            DetectorOutcome outcome = detector.detect(context);
            span.tag("detector.anomalies", String.valueOf(outcome.getAnomalies().size()));
            if (outcome.isFailed()) {
                span.tag("detector.failed", outcome.getFailureReason());
                metricsConfig.recordDetectorFailure(type.code());
                log.warn("Detector {} could not evaluate session {}: {}",
                        type, context.getSessionId(), outcome.getFailureReason());
            }
            return outcome;
        } catch (Exception e) {
            span.error(e);
            metricsConfig.recordDetectorFailure(type.code());
            log.error("Error in {} detector for session {}: {}",
                    type, context.getSessionId(), e.getMessage(), e);
            return DetectorOutcome.failed(type, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            span.end();
        }
    }

    private VehicleBaselineProfile lookupProfile(String vehicleId) {
        if (vehicleId == null) {
            return null;
        }
        try {
            return profileRepository.findByVehicleId(vehicleId);
        } catch (Exception e) {
            metricsConfig.recordProfileLookupFailure();
            log.error("Failed to load baseline profile for vehicle {}: {}", vehicleId, e.getMessage(), e);
            return null;
        }
    }
}
