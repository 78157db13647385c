package alertsuppression.suppression.condition;

import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionRule;
import lombok.Data;

import java.util.Map;
import java.util.Set;

@Data
public class RequiredTagsCondition implements RuleCondition {
    private final Set<String> requiredTags;

    @Override
    public ConditionKind kind() {
        return ConditionKind.REQUIRED_TAGS;
    }

    @Override
    public boolean matches(SuppressionRule rule, SuppressionContext context) {
        Map<String, String> tags = context.getAlert().getTags();
        if (tags == null) {
            return requiredTags.isEmpty();
        }
        return tags.keySet().containsAll(requiredTags);
    }
}
