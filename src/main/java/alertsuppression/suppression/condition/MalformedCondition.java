package alertsuppression.suppression.condition;

import alertsuppression.suppression.EvaluationException;
import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionRule;
import lombok.Data;

/**
 * 无法解析的条件，评估时抛出异常，由调用方按规则未命中处理
 */
@Data
public class MalformedCondition implements RuleCondition {
    private final String key;
    private final Object rawValue;
    private final String error;

    @Override
    public ConditionKind kind() {
        return ConditionKind.MALFORMED;
    }

    @Override
    public boolean matches(SuppressionRule rule, SuppressionContext context) {
        throw new EvaluationException(String.format("规则 %s 条件 '%s' 无效: %s (值: %s)",
                rule.getId(), key, error, rawValue));
    }
}
