package com.vehicle.anomaly.engine.detectors;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.config.DetectionConfigException;
import com.vehicle.anomaly.config.MetricsConfig;
import com.vehicle.anomaly.engine.AnomalyDetector;
import com.vehicle.anomaly.engine.DetectionContext;
import com.vehicle.anomaly.engine.DetectorOutcome;
import com.vehicle.anomaly.engine.isolationforest.AnomalyModel;
import com.vehicle.anomaly.engine.isolationforest.FeatureExtractor;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.model.TelemetrySample;
import com.vehicle.anomaly.repository.AnomalyModelRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores the sample with the pre-trained unsupervised models loaded at start-up.
 *
 * Only models whose name contains the configured filter ("anomaly") take part.
 * A model that labels the feature vector an outlier yields one result. The
 * result is attributed to the sample parameter with the largest absolute
 * reading; this is a coarse stand-in for per-feature attribution.
 *
 * Each model call runs on a bounded pool with a time budget. A model that
 * throws or overruns is logged and skipped without affecting the others.
 * A model whose overrunning call is still on a scoring thread is skipped
 * until that call returns, so a hung model holds at most one thread.
 */
@Component
public class StatisticalModelDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalModelDetector.class);

    private static final double HIGH_SCORE = 0.8;
    private static final double MEDIUM_SCORE = 0.5;

    static final int DEFAULT_SCORING_THREADS = 4;
    private static final int QUEUED_CALLS_PER_THREAD = 64;

    private final Map<String, AnomalyModel> models;
    private final String nameFilter;
    private final long timeoutMs;
    private final MetricsConfig metricsConfig;
    private final ThreadPoolExecutor scoringPool;
    private final Map<String, ModelCall> overrunning = new ConcurrentHashMap<>();

    @Autowired
    public StatisticalModelDetector(AnomalyModelRepository modelRepository,
                                    DetectionConfig config,
                                    MetricsConfig metricsConfig) {
        this(modelRepository.loadAll(), config.getModels().getNameFilter(),
                config.getModels().getTimeoutMs(), config.getModels().getScoringThreads(), metricsConfig);
    }

    public StatisticalModelDetector(Map<String, AnomalyModel> models, String nameFilter,
                                    long timeoutMs, MetricsConfig metricsConfig) {
        this(models, nameFilter, timeoutMs, DEFAULT_SCORING_THREADS, metricsConfig);
    }

    public StatisticalModelDetector(Map<String, AnomalyModel> models, String nameFilter,
                                    long timeoutMs, int scoringThreads, MetricsConfig metricsConfig) {
        if (scoringThreads < 1) {
            throw new DetectionConfigException("scoring-threads must be at least 1, got " + scoringThreads);
        }
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.nameFilter = nameFilter.toLowerCase(Locale.ROOT);
        this.timeoutMs = timeoutMs;
        this.metricsConfig = metricsConfig;
        this.scoringPool = new ThreadPoolExecutor(scoringThreads, scoringThreads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(scoringThreads * QUEUED_CALLS_PER_THREAD), daemonThreads());
        this.scoringPool.allowCoreThreadTimeOut(true);
        log.info("Statistical detector ready with {} models on {} scoring threads: {}",
                this.models.size(), scoringThreads, this.models.keySet());
    }

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.STATISTICAL;
    }

    @Override
    public DetectorOutcome detect(DetectionContext context) {
        ScoringPass pass = score(context.getSample(), context.getTimestamp(), models);
        if (pass.attempted() > 0 && pass.failed() == pass.attempted()) {
            return DetectorOutcome.failed(getAnomalyType(),
                    String.format("all %d eligible models failed", pass.attempted()));
        }
        return DetectorOutcome.ok(getAnomalyType(), pass.results());
    }

    public List<AnomalyResult> evaluate(TelemetrySample sample, Instant timestamp) {
        return evaluate(sample, timestamp, models);
    }

    public List<AnomalyResult> evaluate(TelemetrySample sample, Instant timestamp,
                                        Map<String, AnomalyModel> candidates) {
        return score(sample, timestamp, candidates).results();
    }

    public Map<String, AnomalyModel> getModels() {
        return models;
    }

    @PreDestroy
    public void shutdown() {
        scoringPool.shutdownNow();
    }

    // Threads currently alive in the scoring pool
    int scoringThreadCount() {
        return scoringPool.getPoolSize();
    }

    private ScoringPass score(TelemetrySample sample, Instant timestamp, Map<String, AnomalyModel> candidates) {
        if (candidates.isEmpty() || sample.isEmpty()) {
            return new ScoringPass(Collections.emptyList(), 0, 0);
        }

        double[] features = FeatureExtractor.extract(sample);
        String primary = largestAbsoluteReading(sample);
        List<AnomalyResult> results = new ArrayList<>();
        int attempted = 0;
        int failed = 0;

        for (Map.Entry<String, AnomalyModel> entry : candidates.entrySet()) {
            String name = entry.getKey();
            if (!name.toLowerCase(Locale.ROOT).contains(nameFilter)) {
                continue;
            }
            attempted++;
            if (stillRunning(name)) {
                failed++;
                metricsConfig.recordModelFailure(name, "busy");
                log.warn("Model {} is still busy with a call that exceeded {} ms, skipped", name, timeoutMs);
                continue;
            }
            double[] verdict;
            try {
                verdict = runWithTimeout(name, entry.getValue(), features);
            } catch (RejectedExecutionException e) {
                failed++;
                metricsConfig.recordModelFailure(name, "rejected");
                log.warn("Scoring pool refused a call to model {}: {}", name, e.getMessage());
                continue;
            } catch (TimeoutException e) {
                failed++;
                metricsConfig.recordModelFailure(name, "timeout");
                log.error("Model {} exceeded {} ms, skipped", name, timeoutMs);
                continue;
            } catch (ExecutionException e) {
                failed++;
                metricsConfig.recordModelFailure(name, "error");
                log.error("Error in statistical anomaly detection with {}: {}",
                        name, e.getCause().getMessage(), e.getCause());
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed += 1;
                metricsConfig.recordModelFailure(name, "interrupted");
                log.warn("Interrupted while scoring model {}; remaining models skipped", name);
                break;
            }

            double score = verdict[0];
            if ((int) verdict[1] != AnomalyModel.OUTLIER) {
                continue;
            }
            double magnitude = Math.abs(score);
            results.add(AnomalyResult.builder()
                    .parameterName(primary)
                    .value(sample.get(primary))
                    .anomalyScore(magnitude)
                    .confidence(Math.min(magnitude, 1.0))
                    .severity(severityFor(magnitude))
                    .anomalyType(AnomalyType.STATISTICAL)
                    .description("Statistical anomaly detected by " + name)
                    .recommendedAction("Review recent parameter trends and vehicle condition")
                    .timestamp(timestamp)
                    .build());
        }
        return new ScoringPass(results, attempted, failed);
    }

    private boolean stillRunning(String name) {
        ModelCall previous = overrunning.get(name);
        if (previous == null) {
            return false;
        }
        if (previous.isRunning()) {
            return true;
        }
        overrunning.remove(name, previous);
        return false;
    }

    private double[] runWithTimeout(String name, AnomalyModel model, double[] features)
            throws TimeoutException, ExecutionException, InterruptedException {
        ModelCall call = new ModelCall(model, features);
        Future<double[]> future = scoringPool.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            // A model that ignores the interrupt keeps its thread until it returns
            if (call.isRunning()) {
                overrunning.put(name, call);
            }
            throw e;
        }
    }

    static Severity severityFor(double magnitude) {
        if (magnitude > HIGH_SCORE) return Severity.HIGH;
        if (magnitude > MEDIUM_SCORE) return Severity.MEDIUM;
        return Severity.LOW;
    }

    // First parameter wins ties
    static String largestAbsoluteReading(TelemetrySample sample) {
        String best = null;
        double bestMagnitude = -1.0;
        for (Map.Entry<String, Double> reading : sample.asMap().entrySet()) {
            double magnitude = Math.abs(reading.getValue());
            if (magnitude > bestMagnitude) {
                best = reading.getKey();
                bestMagnitude = magnitude;
            }
        }
        return best;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "model-scoring-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class ModelCall implements Callable<double[]> {
        private final AnomalyModel model;
        private final double[] features;
        private volatile boolean started;
        private volatile boolean finished;

        ModelCall(AnomalyModel model, double[] features) {
            this.model = model;
            this.features = features;
        }

        @Override
        public double[] call() {
            started = true;
            try {
                return new double[]{model.decisionFunction(features), model.predict(features)};
            } finally {
                finished = true;
            }
        }

        boolean isRunning() {
            return started && !finished;
        }
    }

    private record ScoringPass(List<AnomalyResult> results, int attempted, int failed) {}
}
