package alertsuppression.suppression;

import lombok.Builder;
import lombok.Data;

/**
 * 告警所属规则，只保留限流相关配置
 */
@Data
@Builder
public class AlertRule {
    private final String id;
    private final String name;
    private final String teamId;
    @Builder.Default
    private final int maxAlertsPerHour = 10;
    @Builder.Default
    private final int cooldownMinutes = 15;
}
