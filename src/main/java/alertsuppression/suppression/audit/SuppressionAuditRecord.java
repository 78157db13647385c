package alertsuppression.suppression.audit;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.SuppressionResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * alert_suppression_log 索引中的审计记录
 */
@Data
@NoArgsConstructor
public class SuppressionAuditRecord {
    private String id;
    @JsonProperty("alert_id")
    private String alertId;
    private boolean suppressed;
    private String reason;
    @JsonProperty("suppression_rule_id")
    private String suppressionRuleId;
    @JsonProperty("maintenance_window_id")
    private String maintenanceWindowId;
    @JsonProperty("suppress_until")
    private String suppressUntil;
    @JsonProperty("group_key")
    private String groupKey;
    private Map<String, Object> metadata;
    @JsonProperty("created_at")
    private String createdAt;

    public static SuppressionAuditRecord of(Alert alert, SuppressionResult result, Instant now) {
        SuppressionAuditRecord record = new SuppressionAuditRecord();
        record.setId(UUID.randomUUID().toString());
        record.setAlertId(alert.getId());
        record.setSuppressed(result.isShouldSuppress());
        record.setReason(result.getReason().code());
        record.setSuppressionRuleId(result.getSuppressionRuleId());
        record.setMaintenanceWindowId(result.getMaintenanceWindowId());
        // 时间字段统一使用ISO格式
        record.setSuppressUntil(result.getSuppressUntil() != null ? result.getSuppressUntil().toString() : null);
        record.setGroupKey(result.getGroupKey());
        record.setMetadata(new LinkedHashMap<>(result.getMetadata()));
        record.setCreatedAt(now.toString());
        return record;
    }
}
