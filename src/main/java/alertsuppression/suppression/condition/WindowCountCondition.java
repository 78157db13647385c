package alertsuppression.suppression.condition;

import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionRule;
import lombok.Data;

import java.time.Duration;

/**
 * 时间窗口内的历史告警数达到规则的 maxAlertsPerWindow
 */
@Data
public class WindowCountCondition implements RuleCondition {
    private final int windowMinutes;

    @Override
    public ConditionKind kind() {
        return ConditionKind.WINDOW_COUNT;
    }

    @Override
    public boolean matches(SuppressionRule rule, SuppressionContext context) {
        int alertsInWindow = context.alertsWithin(Duration.ofMinutes(windowMinutes)).size();
        return alertsInWindow >= rule.getMaxAlertsPerWindow();
    }
}
