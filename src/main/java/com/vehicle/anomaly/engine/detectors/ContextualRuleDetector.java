package com.vehicle.anomaly.engine.detectors;

import com.vehicle.anomaly.engine.AnomalyDetector;
import com.vehicle.anomaly.engine.DetectionContext;
import com.vehicle.anomaly.engine.DetectorOutcome;
import com.vehicle.anomaly.engine.rules.ContextualRule;
import com.vehicle.anomaly.engine.rules.ContextualRuleSet;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.TelemetrySample;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates cross-parameter rules such as "high RPM at low speed". Each rule
 * that holds produces one result with the rule's own severity and wording,
 * attributed to the rule's primary parameter.
 */
@Component
public class ContextualRuleDetector implements AnomalyDetector {

    static final double RULE_SCORE = 0.8;
    static final double RULE_CONFIDENCE = 0.85;
    static final String UNKNOWN_PARAMETER = "UNKNOWN";

    private final ContextualRuleSet ruleSet;

    public ContextualRuleDetector(ContextualRuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.CONTEXTUAL;
    }

    @Override
    public DetectorOutcome detect(DetectionContext context) {
        return DetectorOutcome.ok(getAnomalyType(), evaluate(context.getSample(), context.getTimestamp()));
    }

    public List<AnomalyResult> evaluate(TelemetrySample sample, Instant timestamp) {
        List<AnomalyResult> results = new ArrayList<>();
        for (ContextualRule rule : ruleSet.getRules()) {
            if (!rule.matches(sample)) {
                continue;
            }
            String parameter = primaryParameter(rule, sample);
            results.add(AnomalyResult.builder()
                    .parameterName(parameter)
                    .value(sample.has(parameter) ? sample.get(parameter) : 0.0)
                    .anomalyScore(RULE_SCORE)
                    .confidence(RULE_CONFIDENCE)
                    .severity(rule.getSeverity())
                    .anomalyType(AnomalyType.CONTEXTUAL)
                    .description(rule.getDescription())
                    .recommendedAction(rule.getRecommendedAction())
                    .timestamp(timestamp)
                    .build());
        }
        return results;
    }

    // A mapped parameter is reported even when the sample lacks it (value 0);
    // unmapped rules fall back to the sample's first parameter
    private static String primaryParameter(ContextualRule rule, TelemetrySample sample) {
        if (rule.getPrimaryParameter() != null) {
            return rule.getPrimaryParameter();
        }
        return sample.isEmpty() ? UNKNOWN_PARAMETER : sample.parameterNames().iterator().next();
    }
}
