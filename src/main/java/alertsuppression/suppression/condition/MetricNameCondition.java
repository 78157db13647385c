package alertsuppression.suppression.condition;

import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionRule;
import lombok.Data;

@Data
public class MetricNameCondition implements RuleCondition {
    private final String metricName;

    @Override
    public ConditionKind kind() {
        return ConditionKind.METRIC_NAME;
    }

    @Override
    public boolean matches(SuppressionRule rule, SuppressionContext context) {
        return metricName.equals(context.getAlert().getMetricName());
    }
}
