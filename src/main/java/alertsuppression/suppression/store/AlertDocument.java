package alertsuppression.suppression.store;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.AlertSeverity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * alerts 索引中的告警文档
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertDocument {
    private String id;
    @JsonProperty("alert_rule_id")
    private String alertRuleId;
    private String title;
    private String severity;
    @JsonProperty("metric_name")
    private String metricName;
    @JsonProperty("metric_value")
    private Double metricValue;
    private Map<String, Object> context;
    private Map<String, Object> tags;
    @JsonProperty("team_id")
    private String teamId;
    @JsonProperty("created_at")
    private String createdAt;

    /**
     * 转换为领域对象，文档 id 缺失时使用 ES 的 _id
     *
     * @throws IllegalArgumentException 级别或时间格式非法
     */
    public Alert toDomain(String documentId) {
        Map<String, String> tagMap = new LinkedHashMap<>();
        if (tags != null) {
            tags.forEach((key, value) -> tagMap.put(key, value != null ? value.toString() : null));
        }

        return Alert.builder()
                .id(id != null ? id : documentId)
                .alertRuleId(alertRuleId)
                .title(title)
                .severity(AlertSeverity.fromString(severity))
                .metricName(metricName)
                .metricValue(metricValue)
                .context(context != null ? context : Collections.emptyMap())
                .tags(tagMap)
                .teamId(teamId)
                .createdAt(StoreDocuments.parseTimestamp(createdAt))
                .build();
    }
}
