package com.vehicle.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vehicle.anomaly.config.AerospikeConfig;
import com.vehicle.anomaly.model.BaselineStats;
import com.vehicle.anomaly.model.VehicleBaselineProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.Map;

/**
 * Read-only access to vehicle baseline profiles. Profiles are written by the
 * offline baseline job; the baseline map is stored as a JSON bin.
 */
@Repository
public class VehicleProfileRepository {

    private static final Logger log = LoggerFactory.getLogger(VehicleProfileRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public VehicleProfileRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @return the vehicle's profile, or null if none has been built yet
     */
    public VehicleBaselineProfile findByVehicleId(String vehicleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_VEHICLE_PROFILES, vehicleId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return null;
        }
        return VehicleBaselineProfile.builder()
                .vehicleId(vehicleId)
                .baselineParameters(deserializeBaseline(vehicleId, record.getString("baseline")))
                .lastUpdated(record.getLong("lastUpdated"))
                .build();
    }

    private Map<String, BaselineStats> deserializeBaseline(String vehicleId, String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, BaselineStats>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize baseline for vehicle {}", vehicleId, e);
            return Collections.emptyMap();
        }
    }
}
