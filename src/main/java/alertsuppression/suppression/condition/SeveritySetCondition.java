package alertsuppression.suppression.condition;

import alertsuppression.suppression.AlertSeverity;
import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionRule;
import lombok.Data;

import java.util.Set;

@Data
public class SeveritySetCondition implements RuleCondition {
    private final Set<AlertSeverity> severities;

    @Override
    public ConditionKind kind() {
        return ConditionKind.SEVERITY_SET;
    }

    @Override
    public boolean matches(SuppressionRule rule, SuppressionContext context) {
        return severities.contains(context.getAlert().getSeverity());
    }
}
