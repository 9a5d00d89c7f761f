package com.vehicle.anomaly.engine.rules;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.config.DetectionConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, validated set of contextual rules. Built once from configuration;
 * any malformed rule aborts start-up.
 */
@Component
public class ContextualRuleSet {

    private static final Logger log = LoggerFactory.getLogger(ContextualRuleSet.class);

    private final List<ContextualRule> rules;

    @Autowired
    public ContextualRuleSet(DetectionConfig config) {
        this(config.getContextualRules());
    }

    public ContextualRuleSet(List<DetectionConfig.RuleProperties> ruleProperties) {
        if (ruleProperties == null) {
            throw new DetectionConfigException("Contextual rule set is missing");
        }
        List<ContextualRule> built = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (DetectionConfig.RuleProperties properties : ruleProperties) {
            ContextualRule rule = build(properties);
            if (!names.add(rule.getName())) {
                throw new DetectionConfigException("Duplicate contextual rule name: " + rule.getName());
            }
            built.add(rule);
        }
        this.rules = Collections.unmodifiableList(built);
        log.info("Loaded {} contextual rules: {}", rules.size(), names);
    }

    public List<ContextualRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    private static ContextualRule build(DetectionConfig.RuleProperties p) {
        if (p == null) {
            throw new DetectionConfigException("Null contextual rule entry");
        }
        String name = p.getName();
        if (name == null || name.isBlank()) {
            throw new DetectionConfigException("Contextual rule without a name");
        }
        if (p.getSeverity() == null) {
            throw new DetectionConfigException("Contextual rule " + name + " has no severity");
        }
        if (p.getDescription() == null || p.getDescription().isBlank()) {
            throw new DetectionConfigException("Contextual rule " + name + " has no description");
        }
        if (p.getAction() == null || p.getAction().isBlank()) {
            throw new DetectionConfigException("Contextual rule " + name + " has no recommended action");
        }
        if (p.getConditions() == null || p.getConditions().isEmpty()) {
            throw new DetectionConfigException("Contextual rule " + name + " has no conditions");
        }

        List<RuleCondition> conditions = new ArrayList<>();
        for (DetectionConfig.ConditionProperties c : p.getConditions()) {
            conditions.add(buildCondition(name, c));
        }

        String primary = p.getPrimaryParameter();
        return ContextualRule.builder()
                .name(name)
                .primaryParameter(primary == null || primary.isBlank() ? null : primary)
                .severity(p.getSeverity())
                .description(p.getDescription())
                .recommendedAction(p.getAction())
                .predicate(ContextualRule.allOf(conditions))
                .build();
    }

    private static RuleCondition buildCondition(String ruleName, DetectionConfig.ConditionProperties c) {
        if (c == null || c.getParameter() == null || c.getParameter().isBlank()) {
            throw new DetectionConfigException("Rule " + ruleName + ": condition without a parameter");
        }
        if (c.getOperator() == null) {
            throw new DetectionConfigException("Rule " + ruleName + ": condition on "
                    + c.getParameter() + " has no operator");
        }
        if (c.getValue() == null || !Double.isFinite(c.getValue())) {
            throw new DetectionConfigException("Rule " + ruleName + ": condition on "
                    + c.getParameter() + " has no finite value");
        }
        boolean needsOther = c.getOperator() == RuleCondition.Operator.ABS_DIFFERENCE_GREATER_THAN;
        boolean hasOther = c.getOtherParameter() != null && !c.getOtherParameter().isBlank();
        if (needsOther != hasOther) {
            throw new DetectionConfigException("Rule " + ruleName + ": operator " + c.getOperator()
                    + (needsOther ? " requires" : " does not take") + " other-parameter");
        }
        return new RuleCondition(c.getParameter(), c.getOperator(), c.getValue(),
                hasOther ? c.getOtherParameter() : null);
    }
}
