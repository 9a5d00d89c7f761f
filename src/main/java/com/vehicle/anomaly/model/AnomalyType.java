package com.vehicle.anomaly.model;

import java.util.Locale;

/**
 * The detection strategy that produced a result. Declaration order is the
 * order in which the engine runs its detectors.
 */
public enum AnomalyType {
    THRESHOLD,
    CONTEXTUAL,
    STATISTICAL,
    PATTERN,
    PROFILE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
