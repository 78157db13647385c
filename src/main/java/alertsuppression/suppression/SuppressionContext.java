package alertsuppression.suppression;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 抑制评估上下文 - 单次评估所需的全部数据
 */
@Data
@Builder
public class SuppressionContext {
    // 待评估告警
    private final Alert alert;
    private final AlertRule rule;
    private final Instant now;                          // 评估时刻，所有窗口以此为基准

    // 工作集
    @Builder.Default
    private final List<Alert> recentAlerts = Collections.emptyList();
    @Builder.Default
    private final List<SuppressionRule> activeSuppressions = Collections.emptyList();
    @Builder.Default
    private final List<MaintenanceWindow> maintenanceWindows = Collections.emptyList();

    /**
     * 最近 window 时间内创建的历史告警
     */
    public List<Alert> alertsWithin(Duration window) {
        Instant cutoff = now.minus(window);
        return recentAlerts.stream()
                .filter(a -> a.getCreatedAt() != null && !a.getCreatedAt().isBefore(cutoff))
                .collect(Collectors.toList());
    }

    /**
     * 最近 window 时间内同规则的历史告警
     */
    public List<Alert> ruleAlertsWithin(String ruleId, Duration window) {
        return alertsWithin(window).stream()
                .filter(a -> ruleId != null && ruleId.equals(a.getAlertRuleId()))
                .collect(Collectors.toList());
    }
}
