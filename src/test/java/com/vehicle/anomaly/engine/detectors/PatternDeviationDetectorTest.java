package com.vehicle.anomaly.engine.detectors;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.HistoryEntry;
import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.model.TelemetrySample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.vehicle.anomaly.testutil.TestDataFactory.NOW;
import static com.vehicle.anomaly.testutil.TestDataFactory.history;
import static com.vehicle.anomaly.testutil.TestDataFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PatternDeviationDetectorTest {

    private final PatternDeviationDetector detector = new PatternDeviationDetector(new DetectionConfig());

    @Test
    void evaluate_spikeAfterOscillatingHistory_high() {
        List<AnomalyResult> results = run("ENGINE_LOAD", 400, oscillating(20));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.getParameterName()).isEqualTo("ENGINE_LOAD");
            assertThat(r.getValue()).isEqualTo(400.0);
            assertThat(r.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(r.getAnomalyType()).isEqualTo(AnomalyType.PATTERN);
            assertThat(r.getAnomalyScore()).isEqualTo(1.0);
            assertThat(r.getConfidence()).isEqualTo(PatternDeviationDetector.PATTERN_CONFIDENCE);
            assertThat(r.getDescription())
                    .isEqualTo("ENGINE_LOAD deviates significantly from recent pattern (Z-score: 60.00)");
            assertThat(r.getRecommendedAction()).isEqualTo("Investigate cause of engine load variation");
        });
    }

    @Test
    void evaluate_zBetweenThresholdAndHighCut_medium() {
        // mean 100, std 5 -> z = 3.5
        List<AnomalyResult> results = run("ENGINE_LOAD", 117.5, oscillating(20));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(r.getAnomalyScore()).isCloseTo(1.0, within(1e-9));
        });
    }

    @Test
    void evaluate_zAtThreshold_notFlagged() {
        assertThat(run("ENGINE_LOAD", 115, oscillating(20))).isEmpty();
    }

    @Test
    void evaluate_constantHistory_noResultEvenForLargeJump() {
        double[] constant = new double[15];
        Arrays.fill(constant, 100.0);

        assertThat(run("ENGINE_LOAD", 400, constant)).isEmpty();
    }

    @Test
    void evaluate_bufferShorterThanMinimum_empty() {
        // 8 earlier samples + current = 9 < 10
        assertThat(run("ENGINE_LOAD", 400, oscillating(8))).isEmpty();
    }

    @Test
    void evaluate_bufferAtMinimum_evaluated() {
        // 9 earlier samples + current = 10
        assertThat(run("ENGINE_LOAD", 400, oscillating(9))).hasSize(1);
    }

    @Test
    void evaluate_tooFewReferencePointsForParameter_skipped() {
        List<HistoryEntry> buffer = new ArrayList<>(history("SPEED", 80, 81, 79, 80, 81, 79, 80, 81));
        buffer.addAll(history("ENGINE_LOAD", 95, 105, 95));
        TelemetrySample current = sample("ENGINE_LOAD", 400);
        buffer.add(new HistoryEntry(current, NOW));

        assertThat(detector.evaluate("S1", current, buffer, NOW)).isEmpty();
    }

    private List<AnomalyResult> run(String parameter, double current, double[] earlier) {
        double[] all = Arrays.copyOf(earlier, earlier.length + 1);
        all[earlier.length] = current;
        List<HistoryEntry> buffer = history(parameter, all);
        return detector.evaluate("S1", sample(parameter, current), buffer, NOW);
    }

    private static double[] oscillating(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i % 2 == 0 ? 95.0 : 105.0;
        }
        return values;
    }
}
