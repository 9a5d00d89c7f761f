package com.vehicle.anomaly.engine.rules;

import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.model.TelemetrySample;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.function.Predicate;

/**
 * A named cross-parameter predicate with the fixed severity, description and
 * recommended action reported when it holds.
 */
@Value
@Builder
public class ContextualRule {

    String name;

    // Parameter reported on the result; may be null
    String primaryParameter;

    Severity severity;

    String description;

    String recommendedAction;

    Predicate<TelemetrySample> predicate;

    public boolean matches(TelemetrySample sample) {
        return predicate.test(sample);
    }

    /**
     * Conjunction of conditions: the rule holds when every condition holds.
     */
    public static Predicate<TelemetrySample> allOf(List<RuleCondition> conditions) {
        List<RuleCondition> copy = List.copyOf(conditions);
        return sample -> {
            for (RuleCondition condition : copy) {
                if (!condition.test(sample)) {
                    return false;
                }
            }
            return true;
        };
    }
}
