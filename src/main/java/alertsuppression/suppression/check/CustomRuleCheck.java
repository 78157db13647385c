package alertsuppression.suppression.check;

import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;
import alertsuppression.suppression.SuppressionRule;
import alertsuppression.suppression.condition.RuleCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 自定义抑制规则检查，按优先级从高到低，第一条命中的规则生效
 */
public class CustomRuleCheck implements SuppressionCheck {
    private static final Logger logger = LoggerFactory.getLogger(CustomRuleCheck.class);

    @Override
    public String name() {
        return "custom_rules";
    }

    @Override
    public Optional<SuppressionResult> check(SuppressionContext context) {
        List<SuppressionRule> applicableRules = context.getActiveSuppressions().stream()
                .filter(SuppressionRule::isEnabled)
                .filter(rule -> rule.appliesTo(context.getAlert()))
                .sorted(SuppressionRule.BY_PRIORITY_DESC)
                .collect(Collectors.toList());

        for (SuppressionRule rule : applicableRules) {
            try {
                if (matches(rule, context)) {
                    return Optional.of(buildResult(rule, context));
                }
            } catch (Exception e) {
                // 单条规则失败不影响后续规则
                logger.warn("自定义抑制规则评估失败，按未命中处理: {} ({})", rule.getName(), rule.getId(), e);
            }
        }
        return Optional.empty();
    }

    private boolean matches(SuppressionRule rule, SuppressionContext context) {
        for (RuleCondition condition : rule.getConditions()) {
            if (!condition.matches(rule, context)) {
                logger.debug("规则 {} 条件未满足: {}", rule.getName(), condition.kind());
                return false;
            }
        }
        return true;
    }

    private SuppressionResult buildResult(SuppressionRule rule, SuppressionContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ruleName", rule.getName());
        metadata.put("ruleType", rule.getRuleType().code());
        metadata.put("suppressionMinutes", rule.getSuppressionDurationMinutes());

        return SuppressionResult.suppressed(SuppressionReason.CUSTOM_RULE_MATCHED,
                        context.getNow().plus(Duration.ofMinutes(rule.getSuppressionDurationMinutes())), metadata)
                .toBuilder()
                .suppressionRuleId(rule.getId())
                .build();
    }
}
