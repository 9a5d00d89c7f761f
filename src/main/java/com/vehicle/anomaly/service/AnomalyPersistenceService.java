package com.vehicle.anomaly.service;

import com.vehicle.anomaly.config.MetricsConfig;
import com.vehicle.anomaly.model.AnomalyRecord;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.repository.AnomalyRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes detected anomalies to the anomaly store off the detection thread.
 * Every record is saved on its own; a failed write is logged and counted and
 * the remaining records are still attempted.
 */
@Service
public class AnomalyPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPersistenceService.class);

    private final AnomalyRecordRepository recordRepository;
    private final MetricsConfig metricsConfig;

    public AnomalyPersistenceService(AnomalyRecordRepository recordRepository, MetricsConfig metricsConfig) {
        this.recordRepository = recordRepository;
        this.metricsConfig = metricsConfig;
    }

    @Async
    public void persistAll(String sessionId, String vehicleId, List<AnomalyResult> anomalies) {
        int saved = 0;
        for (AnomalyResult anomaly : anomalies) {
            try {
                recordRepository.save(AnomalyRecord.from(sessionId, vehicleId, anomaly));
                metricsConfig.recordPersistence("success");
                saved++;
            } catch (Exception e) {
                metricsConfig.recordPersistence("error");
                log.error("Failed to persist {} anomaly on {} for session {}: {}",
                        anomaly.getAnomalyType(), anomaly.getParameterName(), sessionId, e.getMessage(), e);
            }
        }
        if (!anomalies.isEmpty()) {
            log.debug("Persisted {}/{} anomalies for session {}", saved, anomalies.size(), sessionId);
        }
    }
}
