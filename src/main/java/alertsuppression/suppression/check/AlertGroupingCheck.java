package alertsuppression.suppression.check;

import alertsuppression.suppression.AlertGroupingEngine;
import alertsuppression.suppression.AlertGroupingEngine.GroupingDecision;
import alertsuppression.suppression.AlertSeverity;
import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 告警分组检查，每次调用都会把告警计入分组
 */
public class AlertGroupingCheck implements SuppressionCheck {
    private final AlertGroupingEngine groupingEngine;

    public AlertGroupingCheck(AlertGroupingEngine groupingEngine) {
        this.groupingEngine = groupingEngine;
    }

    @Override
    public String name() {
        return "alert_grouping";
    }

    @Override
    public Optional<SuppressionResult> check(SuppressionContext context) {
        GroupingDecision decision = groupingEngine.offer(context.getAlert(), context.getNow());
        if (!decision.isSuppressed()) {
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("groupSize", decision.getCount());
        metadata.put("timeSpanMinutes", decision.getTimeSpan().toMinutes());
        metadata.put("firstAlertAt", decision.getFirstAlertAt().toString());
        metadata.put("groupingSeverities", decision.getSeverities().stream()
                .map(AlertSeverity::code)
                .collect(Collectors.toList()));

        return Optional.of(SuppressionResult.suppressed(SuppressionReason.ALERT_GROUPING, null, metadata)
                .toBuilder()
                .groupKey(decision.getGroupKey())
                .relatedAlerts(decision.getMemberIds())
                .build());
    }
}
