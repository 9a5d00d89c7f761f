package com.vehicle.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.vehicle.anomaly.config.AerospikeConfig;
import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.model.AnomalyRecord;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Repository
public class AnomalyRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRecordRepository.class);

    private static final int SECONDS_PER_DAY = 86400;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public AnomalyRecordRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy defaultWritePolicy,
                                   DetectionConfig config) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = new WritePolicy(defaultWritePolicy);
        int ttlDays = config.getPersistence().getAnomalyRecordTtlDays();
        this.writePolicy.expiration = ttlDays > 0 ? ttlDays * SECONDS_PER_DAY : -1;
    }

    /**
     * Append one anomaly record. Assigns a record id when the record has none.
     */
    public void save(AnomalyRecord record) {
        if (record.getRecordId() == null) {
            record.setRecordId(UUID.randomUUID().toString());
        }
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RECORDS, record.getRecordId());

        client.put(writePolicy, key,
                new Bin("recordId", record.getRecordId()),
                new Bin("sessionId", record.getSessionId()),
                new Bin("vehicleId", record.getVehicleId()),
                new Bin("parameter", record.getParameterName()),
                new Bin("value", record.getValue()),
                new Bin("score", record.getAnomalyScore()),
                new Bin("confidence", record.getConfidence()),
                new Bin("severity", record.getSeverity().name()),
                new Bin("anomalyType", record.getAnomalyType().name()),
                new Bin("description", record.getDescription()),
                new Bin("action", record.getRecommendedAction()),
                new Bin("timestamp", record.getTimestamp()));
    }

    /**
     * All records of a session detected at or after {@code sinceEpochMillis}, newest first.
     */
    public List<AnomalyRecord> findBySessionId(String sessionId, long sinceEpochMillis) {
        List<AnomalyRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RECORDS,
                (key, record) -> {
                    if (!sessionId.equals(record.getString("sessionId"))
                            || record.getLong("timestamp") < sinceEpochMillis) {
                        return;
                    }
                    try {
                        AnomalyRecord mapped = mapRecord(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    } catch (IllegalArgumentException | NullPointerException e) {
                        log.warn("Skipping malformed anomaly record {}: {}",
                                record.getString("recordId"), e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AnomalyRecord::getTimestamp).reversed());
        return results;
    }

    private AnomalyRecord mapRecord(Record record) {
        return AnomalyRecord.builder()
                .recordId(record.getString("recordId"))
                .sessionId(record.getString("sessionId"))
                .vehicleId(record.getString("vehicleId"))
                .parameterName(record.getString("parameter"))
                .value(record.getDouble("value"))
                .anomalyScore(record.getDouble("score"))
                .confidence(record.getDouble("confidence"))
                .severity(Severity.valueOf(record.getString("severity")))
                .anomalyType(AnomalyType.valueOf(record.getString("anomalyType")))
                .description(record.getString("description"))
                .recommendedAction(record.getString("action"))
                .timestamp(record.getLong("timestamp"))
                .build();
    }
}
