package alertsuppression.suppression.condition;

import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionRule;

/**
 * 自定义抑制规则的单个条件，规则的全部条件同时满足才命中
 */
public interface RuleCondition {

    ConditionKind kind();

    /**
     * @throws alertsuppression.suppression.EvaluationException 条件无法评估
     */
    boolean matches(SuppressionRule rule, SuppressionContext context);
}
