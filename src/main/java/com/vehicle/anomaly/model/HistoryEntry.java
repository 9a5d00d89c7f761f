package com.vehicle.anomaly.model;

import lombok.Value;

import java.time.Instant;

/**
 * One sample held in a session buffer together with the time it was appended.
 */
@Value
public class HistoryEntry {
    TelemetrySample sample;
    Instant timestamp;
}
