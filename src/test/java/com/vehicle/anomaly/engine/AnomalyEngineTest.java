package com.vehicle.anomaly.engine;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.config.MetricsConfig;
import com.vehicle.anomaly.engine.detectors.ContextualRuleDetector;
import com.vehicle.anomaly.engine.detectors.PatternDeviationDetector;
import com.vehicle.anomaly.engine.detectors.ProfileDeviationDetector;
import com.vehicle.anomaly.engine.detectors.StatisticalModelDetector;
import com.vehicle.anomaly.engine.detectors.ThresholdDetector;
import com.vehicle.anomaly.engine.rules.ContextualRuleSet;
import com.vehicle.anomaly.engine.threshold.ParameterThresholdTable;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.HistoryEntry;
import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.model.TelemetrySample;
import com.vehicle.anomaly.repository.VehicleProfileRepository;
import com.vehicle.anomaly.service.AnomalyPersistenceService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.vehicle.anomaly.testutil.TestDataFactory.NOW;
import static com.vehicle.anomaly.testutil.TestDataFactory.baseline;
import static com.vehicle.anomaly.testutil.TestDataFactory.profile;
import static com.vehicle.anomaly.testutil.TestDataFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyEngineTest {

    @Mock private VehicleProfileRepository profileRepository;
    @Mock private AnomalyPersistenceService persistenceService;

    private DetectionConfig config;
    private SimpleMeterRegistry registry;
    private MetricsConfig metrics;
    private MutableClock clock;
    private StatisticalModelDetector statisticalDetector;
    private AnomalyEngine engine;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        registry = new SimpleMeterRegistry();
        metrics = new MetricsConfig(registry);
        clock = new MutableClock(NOW);
        statisticalDetector = new StatisticalModelDetector(Collections.emptyMap(), "anomaly", 250, metrics);
        engine = engineWith(statisticalDetector);
    }

    @AfterEach
    void tearDown() {
        statisticalDetector.shutdown();
    }

    @Test
    void detect_threeLimitBreaches_resultsReturnedAndHandedToPersistence() {
        List<AnomalyResult> results = engine.detect(
                Map.of("ENGINE_RPM", 7000, "COOLANT_TEMP", 130, "OIL_PRESSURE", 1.0), "S1", null);

        assertThat(results).filteredOn(r -> r.getAnomalyType() == AnomalyType.THRESHOLD)
                .hasSize(3)
                .allSatisfy(r -> assertThat(r.getSeverity()).isIn(Severity.HIGH, Severity.CRITICAL));
        // low oil pressure at operating RPM
        assertThat(results).filteredOn(r -> r.getAnomalyType() == AnomalyType.CONTEXTUAL)
                .singleElement().extracting(AnomalyResult::getSeverity).isEqualTo(Severity.CRITICAL);
        assertThat(results.get(0).getAnomalyType()).isEqualTo(AnomalyType.THRESHOLD);
        assertThat(results).allSatisfy(r -> assertThat(r.getTimestamp()).isEqualTo(NOW));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AnomalyResult>> captor = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).persistAll(eq("S1"), isNull(), captor.capture());
        assertThat(captor.getValue()).isEqualTo(results);
    }

    @Test
    void detect_callerClearsResults_persistedListUnchanged() {
        List<AnomalyResult> results = engine.detect(
                Map.of("ENGINE_RPM", 7000, "COOLANT_TEMP", 130, "OIL_PRESSURE", 1.0), "S1", null);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AnomalyResult>> captor = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).persistAll(eq("S1"), isNull(), captor.capture());
        List<AnomalyResult> handedOff = captor.getValue();
        assertThat(handedOff).hasSize(4).isNotSameAs(results);

        results.clear();

        assertThat(handedOff).hasSize(4);
        assertThatThrownBy(handedOff::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void detect_healthySample_noAnomalies() {
        List<AnomalyResult> results = engine.detect(
                Map.of("ENGINE_RPM", 2000, "SPEED", 80, "COOLANT_TEMP", 90), "S1", null);

        assertThat(results).isEmpty();
        assertThat(engine.getSessionHistory("S1")).hasSize(1);
    }

    @Test
    void detect_spikeAfterStableSession_patternResult() {
        for (int i = 0; i < 20; i++) {
            engine.detect(Map.of("ENGINE_LOAD", i % 2 == 0 ? 45 : 55), "S1", null);
        }

        List<AnomalyResult> results = engine.detect(Map.of("ENGINE_LOAD", 400), "S1", null);

        assertThat(results).extracting(AnomalyResult::getAnomalyType)
                .containsExactly(AnomalyType.THRESHOLD, AnomalyType.PATTERN);
        assertThat(results.get(1).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void detect_withVehicleId_profileLoadedOnceAndCompared() {
        when(profileRepository.findByVehicleId("VIN-1"))
                .thenReturn(profile("VIN-1", Map.of("COOLANT_TEMP", baseline(90.0, 2.0))));

        List<AnomalyResult> results = engine.detect(Map.of("COOLANT_TEMP", 95), "S1", "VIN-1");

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.getAnomalyType()).isEqualTo(AnomalyType.PROFILE);
            assertThat(r.getSeverity()).isEqualTo(Severity.LOW);
        });
        verify(profileRepository, times(1)).findByVehicleId("VIN-1");
        verify(persistenceService).persistAll(eq("S1"), eq("VIN-1"), anyList());
    }

    @Test
    void detect_profileLookupFails_treatedAsAbsent() {
        when(profileRepository.findByVehicleId("VIN-1")).thenThrow(new IllegalStateException("store down"));

        List<AnomalyResult> results = engine.detect(Map.of("COOLANT_TEMP", 130), "S1", "VIN-1");

        assertThat(results).extracting(AnomalyResult::getAnomalyType).containsExactly(AnomalyType.THRESHOLD);
        assertThat(registry.get("profile.lookup.failure.count").counter().count()).isEqualTo(1.0);
    }

    @Test
    void detect_detectorThrows_othersStillReported() {
        AnomalyDetector broken = mock(AnomalyDetector.class);
        when(broken.getAnomalyType()).thenReturn(AnomalyType.STATISTICAL);
        when(broken.detect(any())).thenThrow(new IllegalStateException("boom"));
        AnomalyEngine withBroken = engineWith(broken);

        List<AnomalyResult> results = withBroken.detect(Map.of("COOLANT_TEMP", 130), "S1", null);

        assertThat(results).singleElement()
                .extracting(AnomalyResult::getAnomalyType).isEqualTo(AnomalyType.THRESHOLD);
        assertThat(registry.get("detector.failure.count")
                .tag("anomaly_type", "statistical").counter().count()).isEqualTo(1.0);
    }

    @Test
    void detect_persistenceFails_resultsStillReturned() {
        doThrow(new IllegalStateException("executor rejected"))
                .when(persistenceService).persistAll(any(), any(), anyList());

        List<AnomalyResult> results = engine.detect(Map.of("COOLANT_TEMP", 130), "S1", null);

        assertThat(results).hasSize(1);
    }

    @Test
    void detect_invalidArguments_rejected() {
        assertThatThrownBy(() -> engine.detect(sample("SPEED", 10), " ", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.detect((TelemetrySample) null, "S1", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void evaluate_sameContextTwice_sameOutcomesAndNoBufferChange() {
        engine.detect(Map.of("COOLANT_TEMP", 90), "S1", null);
        List<HistoryEntry> history = engine.getSessionHistory("S1");
        DetectionContext context = DetectionContext.builder()
                .sessionId("S1")
                .sample(sample("COOLANT_TEMP", 130, "ENGINE_RPM", 3500, "SPEED", 5))
                .timestamp(NOW)
                .history(history)
                .build();

        List<DetectorOutcome> first = engine.evaluate(context);
        List<DetectorOutcome> second = engine.evaluate(context);

        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(DetectorOutcome::getAnomalyType).containsExactly(AnomalyType.values());
        assertThat(first).noneMatch(DetectorOutcome::isFailed);
        assertThat(engine.getSessionHistory("S1")).isEqualTo(history);
    }

    @Test
    void evaluate_failingDetector_reportedAsFailedOutcome() {
        AnomalyDetector broken = mock(AnomalyDetector.class);
        when(broken.getAnomalyType()).thenReturn(AnomalyType.STATISTICAL);
        when(broken.detect(any())).thenThrow(new IllegalStateException("boom"));
        AnomalyEngine withBroken = engineWith(broken);
        DetectionContext context = DetectionContext.builder()
                .sessionId("S1").sample(sample("SPEED", 10)).timestamp(NOW).build();

        List<DetectorOutcome> outcomes = withBroken.evaluate(context);

        assertThat(outcomes).filteredOn(DetectorOutcome::isFailed).singleElement().satisfies(o -> {
            assertThat(o.getAnomalyType()).isEqualTo(AnomalyType.STATISTICAL);
            assertThat(o.getFailureReason()).contains("boom");
        });
    }

    @Test
    void sessionHistory_boundedByBufferSize() {
        config.getHistory().setBufferSize(5);
        AnomalyEngine small = engineWith(statisticalDetector);

        for (int i = 0; i < 12; i++) {
            small.detect(Map.of("SPEED", i), "S1", null);
        }

        assertThat(small.getSessionHistory("S1")).extracting(e -> e.getSample().get("SPEED"))
                .containsExactly(7.0, 8.0, 9.0, 10.0, 11.0);
    }

    @Test
    void cleanupStaleSessions_removesIdleSessionsOnly() {
        engine.detect(Map.of("SPEED", 10), "idle", null);
        clock.advance(Duration.ofHours(30));
        engine.detect(Map.of("SPEED", 10), "busy", null);

        int removed = engine.cleanupStaleSessions(Duration.ofHours(24));

        assertThat(removed).isEqualTo(1);
        assertThat(engine.getActiveSessionCount()).isEqualTo(1);
        assertThat(engine.getSessionHistory("idle")).isEmpty();
        assertThat(registry.get("telemetry.sessions.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void constructor_twoDetectorsForSameType_rejected() {
        List<AnomalyDetector> detectors = new ArrayList<>(defaultDetectors(statisticalDetector));
        detectors.add(new ProfileDeviationDetector());

        assertThatThrownBy(() -> new AnomalyEngine(detectors, profileRepository, persistenceService,
                config, clock, Tracer.NOOP, metrics))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PROFILE");
    }

    private AnomalyEngine engineWith(AnomalyDetector statistical) {
        return new AnomalyEngine(defaultDetectors(statistical), profileRepository, persistenceService,
                config, clock, Tracer.NOOP, metrics);
    }

    private List<AnomalyDetector> defaultDetectors(AnomalyDetector statistical) {
        return List.of(
                // registration order must not matter
                new ProfileDeviationDetector(),
                new ThresholdDetector(new ParameterThresholdTable(config)),
                new ContextualRuleDetector(new ContextualRuleSet(config)),
                statistical,
                new PatternDeviationDetector(config));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
