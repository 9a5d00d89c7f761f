package com.vehicle.anomaly.engine.rules;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.config.DetectionConfigException;
import com.vehicle.anomaly.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextualRuleSetTest {

    @Test
    void defaultRules_allFiveLoadedInOrder() {
        ContextualRuleSet ruleSet = new ContextualRuleSet(DetectionConfig.defaultContextualRules());

        assertThat(ruleSet.size()).isEqualTo(5);
        assertThat(ruleSet.getRules()).extracting(ContextualRule::getName).containsExactly(
                "high_rpm_low_speed", "high_temp_normal_load", "low_oil_pressure",
                "air_suspension_imbalance", "transmission_overheating");
    }

    @Test
    void duplicateRuleName_rejected() {
        List<DetectionConfig.RuleProperties> rules = new ArrayList<>();
        rules.add(rule("hot", condition("TRANS_TEMP", RuleCondition.Operator.GREATER_THAN, 110.0, null)));
        rules.add(rule("hot", condition("COOLANT_TEMP", RuleCondition.Operator.GREATER_THAN, 100.0, null)));

        assertThatThrownBy(() -> new ContextualRuleSet(rules))
                .isInstanceOf(DetectionConfigException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void ruleWithoutConditions_rejected() {
        DetectionConfig.RuleProperties empty = rule("empty");

        assertThatThrownBy(() -> new ContextualRuleSet(List.of(empty)))
                .isInstanceOf(DetectionConfigException.class)
                .hasMessageContaining("no conditions");
    }

    @Test
    void ruleWithoutSeverity_rejected() {
        DetectionConfig.RuleProperties rule = rule("hot",
                condition("TRANS_TEMP", RuleCondition.Operator.GREATER_THAN, 110.0, null));
        rule.setSeverity(null);

        assertThatThrownBy(() -> new ContextualRuleSet(List.of(rule)))
                .isInstanceOf(DetectionConfigException.class)
                .hasMessageContaining("severity");
    }

    @Test
    void differenceOperatorWithoutOtherParameter_rejected() {
        DetectionConfig.RuleProperties rule = rule("imbalance",
                condition("AIR_PRESSURE_FL", RuleCondition.Operator.ABS_DIFFERENCE_GREATER_THAN, 2.0, null));

        assertThatThrownBy(() -> new ContextualRuleSet(List.of(rule)))
                .isInstanceOf(DetectionConfigException.class)
                .hasMessageContaining("requires");
    }

    @Test
    void comparisonWithOtherParameter_rejected() {
        DetectionConfig.RuleProperties rule = rule("hot",
                condition("TRANS_TEMP", RuleCondition.Operator.GREATER_THAN, 110.0, "COOLANT_TEMP"));

        assertThatThrownBy(() -> new ContextualRuleSet(List.of(rule)))
                .isInstanceOf(DetectionConfigException.class)
                .hasMessageContaining("does not take");
    }

    @Test
    void conditionWithoutValue_rejected() {
        DetectionConfig.RuleProperties rule = rule("hot",
                condition("TRANS_TEMP", RuleCondition.Operator.GREATER_THAN, null, null));

        assertThatThrownBy(() -> new ContextualRuleSet(List.of(rule)))
                .isInstanceOf(DetectionConfigException.class)
                .hasMessageContaining("finite value");
    }

    private static DetectionConfig.RuleProperties rule(String name, DetectionConfig.ConditionProperties... conditions) {
        return new DetectionConfig.RuleProperties(name, null, Severity.HIGH, "description", "action",
                new ArrayList<>(List.of(conditions)));
    }

    private static DetectionConfig.ConditionProperties condition(String parameter, RuleCondition.Operator operator,
                                                                  Double value, String other) {
        return new DetectionConfig.ConditionProperties(parameter, operator, value, other);
    }
}
