package com.vehicle.anomaly.engine.detectors;

import java.util.Locale;

final class ParameterNames {

    private ParameterNames() {}

    /**
     * COOLANT_TEMP -> "coolant temp", as used in operator-facing actions.
     */
    static String humanize(String parameter) {
        return parameter.toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
