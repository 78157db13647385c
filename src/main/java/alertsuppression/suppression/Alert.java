package alertsuppression.suppression;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * 上游产生的告警，每条告警只会被评估一次
 */
@Data
@Builder
public class Alert {
    private final String id;
    private final String alertRuleId;
    private final String title;
    private final AlertSeverity severity;
    private final String metricName;
    private final Double metricValue;          // 可为空
    @Builder.Default
    private final Map<String, Object> context = Collections.emptyMap();
    @Builder.Default
    private final Map<String, String> tags = Collections.emptyMap();
    private final String teamId;
    private final Instant createdAt;

    public boolean hasMetricValue() {
        return metricValue != null && !metricValue.isNaN();
    }
}
