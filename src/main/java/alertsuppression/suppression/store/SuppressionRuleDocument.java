package alertsuppression.suppression.store;

import alertsuppression.suppression.SuppressionRule;
import alertsuppression.suppression.SuppressionRuleType;
import alertsuppression.suppression.condition.RuleConditionParser;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * alert_suppression_rules 索引中的规则文档，数值字段缺失时取库表默认值
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SuppressionRuleDocument {
    private String id;
    private String name;
    private String description;
    @JsonProperty("rule_type")
    private String ruleType;
    private Map<String, Object> conditions;
    @JsonProperty("suppression_duration_minutes")
    private Integer suppressionDurationMinutes;
    @JsonProperty("max_alerts_per_window")
    private Integer maxAlertsPerWindow;
    @JsonProperty("window_size_minutes")
    private Integer windowSizeMinutes;
    private Boolean enabled;
    private Integer priority;
    @JsonProperty("team_id")
    private String teamId;

    public SuppressionRule toDomain(String documentId) {
        return SuppressionRule.builder()
                .id(id != null ? id : documentId)
                .name(name)
                .description(description)
                .ruleType(SuppressionRuleType.fromString(ruleType))
                .conditions(RuleConditionParser.parse(conditions))
                .suppressionDurationMinutes(suppressionDurationMinutes != null ? suppressionDurationMinutes : 60)
                .maxAlertsPerWindow(maxAlertsPerWindow != null ? maxAlertsPerWindow : 5)
                .windowSizeMinutes(windowSizeMinutes != null ? windowSizeMinutes : 60)
                .enabled(enabled == null || enabled)
                .priority(priority != null ? priority : 1)
                .teamId(teamId)
                .build();
    }
}
