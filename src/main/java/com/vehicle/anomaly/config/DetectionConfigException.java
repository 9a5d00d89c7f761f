package com.vehicle.anomaly.config;

/**
 * Raised while building the threshold table or rule set from configuration.
 * Fails application start-up; the engine never runs on partial configuration.
 */
public class DetectionConfigException extends RuntimeException {

    public DetectionConfigException(String message) {
        super(message);
    }
}
