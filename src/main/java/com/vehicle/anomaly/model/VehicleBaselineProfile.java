package com.vehicle.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-vehicle baseline maintained outside the engine. Read once per detection
 * call and never modified by it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleBaselineProfile {

    private String vehicleId;

    @Builder.Default
    private Map<String, BaselineStats> baselineParameters = new HashMap<>();

    @Builder.Default
    private long lastUpdated = 0;

    public boolean hasBaseline() {
        return baselineParameters != null && !baselineParameters.isEmpty();
    }
}
