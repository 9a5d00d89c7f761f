package com.vehicle.anomaly.engine;

import com.vehicle.anomaly.model.HistoryEntry;
import com.vehicle.anomaly.model.TelemetrySample;
import com.vehicle.anomaly.model.VehicleBaselineProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Everything a detector may look at for one detection call. Built by the
 * engine after the session buffer has been updated; detectors never see the
 * live buffer.
 */
@Value
@Builder
public class DetectionContext {

    String sessionId;

    // null when the caller did not identify the vehicle
    String vehicleId;

    TelemetrySample sample;

    Instant timestamp;

    // Session buffer snapshot, current sample last
    @Builder.Default
    List<HistoryEntry> history = Collections.emptyList();

    // null when absent or not looked up
    VehicleBaselineProfile profile;
}
