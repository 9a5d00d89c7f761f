package com.vehicle.anomaly.engine;

import com.vehicle.anomaly.model.AnomalyType;

/**
 * Interface for all detection strategies.
 * Each implementation produces results of exactly one AnomalyType.
 */
public interface AnomalyDetector {

    /**
     * The anomaly type this detector emits.
     */
    AnomalyType getAnomalyType();

    /**
     * Evaluate the sample in the context against this detector's strategy.
     *
     * @param context sample, session snapshot and baseline for one detection call
     * @return the results, or a failed outcome if the detector could not evaluate
     */
    DetectorOutcome detect(DetectionContext context);
}
