package com.vehicle.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Historical statistics of one parameter for one vehicle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineStats {

    private double mean;

    private double std;

    private double min;

    private double max;

    private double median;

    // epoch millis
    private long lastUpdated;
}
