package alertsuppression.suppression;

import alertsuppression.suppression.condition.RuleCondition;
import lombok.Builder;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 自定义抑制规则，priority越大越先评估
 */
@Data
@Builder
public class SuppressionRule {

    /**
     * 按优先级降序
     */
    public static final Comparator<SuppressionRule> BY_PRIORITY_DESC =
            Comparator.comparingInt(SuppressionRule::getPriority).reversed();

    private final String id;
    private final String name;
    private final String description;
    @Builder.Default
    private final SuppressionRuleType ruleType = SuppressionRuleType.CUSTOM;
    @Builder.Default
    private final List<RuleCondition> conditions = Collections.emptyList();
    @Builder.Default
    private final int suppressionDurationMinutes = 60;
    @Builder.Default
    private final int maxAlertsPerWindow = 5;
    @Builder.Default
    private final int windowSizeMinutes = 60;
    @Builder.Default
    private final boolean enabled = true;
    @Builder.Default
    private final int priority = 1;
    private final String teamId;                // 为空表示全局规则

    /**
     * 规则是否作用于该告警所属的团队
     */
    public boolean appliesTo(Alert alert) {
        return StringUtils.isEmpty(teamId) || teamId.equals(alert.getTeamId());
    }
}
