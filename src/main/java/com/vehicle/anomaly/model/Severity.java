package com.vehicle.anomaly.model;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Lower-case code used in persisted records and log lines.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
