package com.vehicle.anomaly.engine.rules;

import com.vehicle.anomaly.model.TelemetrySample;
import lombok.Value;

/**
 * One comparison inside a contextual rule. A condition that references a
 * parameter missing from the sample never holds.
 */
@Value
public class RuleCondition {

    public enum Operator {
        GREATER_THAN,
        LESS_THAN,
        // |parameter - otherParameter| > value
        ABS_DIFFERENCE_GREATER_THAN
    }

    String parameter;
    Operator operator;
    double value;
    String otherParameter;

    public boolean test(TelemetrySample sample) {
        if (!sample.has(parameter)) {
            return false;
        }
        double reading = sample.get(parameter);
        switch (operator) {
            case GREATER_THAN:
                return reading > value;
            case LESS_THAN:
                return reading < value;
            case ABS_DIFFERENCE_GREATER_THAN:
                if (!sample.has(otherParameter)) {
                    return false;
                }
                return Math.abs(reading - sample.get(otherParameter)) > value;
            default:
                throw new IllegalStateException("Unhandled operator: " + operator);
        }
    }

    @Override
    public String toString() {
        if (operator == Operator.ABS_DIFFERENCE_GREATER_THAN) {
            return String.format("|%s - %s| > %s", parameter, otherParameter, value);
        }
        return String.format("%s %s %s", parameter, operator == Operator.GREATER_THAN ? ">" : "<", value);
    }
}
