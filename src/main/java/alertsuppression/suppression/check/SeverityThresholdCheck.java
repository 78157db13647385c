package alertsuppression.suppression.check;

import alertsuppression.suppression.AlertSeverity;
import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 高级别告警集中爆发时，抑制低级别告警
 */
public class SeverityThresholdCheck implements SuppressionCheck {
    private final Duration window;
    private final int highSeverityCount;
    private final Duration suppression;

    public SeverityThresholdCheck(Duration window, int highSeverityCount, Duration suppression) {
        this.window = window;
        this.highSeverityCount = highSeverityCount;
        this.suppression = suppression;
    }

    @Override
    public String name() {
        return "high_severity_threshold";
    }

    @Override
    public Optional<SuppressionResult> check(SuppressionContext context) {
        AlertSeverity severity = context.getAlert().getSeverity();
        if (severity == null || !severity.isLowSeverity()) {
            return Optional.empty();
        }

        long highSeverityAlerts = context.alertsWithin(window).stream()
                .filter(alert -> alert.getSeverity() != null && alert.getSeverity().isHighSeverity())
                .count();
        if (highSeverityAlerts < highSeverityCount) {
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("highSeverityCount", highSeverityAlerts);
        metadata.put("threshold", highSeverityCount);
        metadata.put("suppressionMinutes", suppression.toMinutes());
        return Optional.of(SuppressionResult.suppressed(SuppressionReason.HIGH_SEVERITY_THRESHOLD,
                context.getNow().plus(suppression), metadata));
    }
}
