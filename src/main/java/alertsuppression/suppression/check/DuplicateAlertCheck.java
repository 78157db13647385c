package alertsuppression.suppression.check;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 重复告警检查 - 同规则下指标值接近或上下文基本一致的告警视为重复
 */
public class DuplicateAlertCheck implements SuppressionCheck {
    private final Duration duplicateWindow;
    private final double valueTolerance;
    private final double contextMatchRatio;

    public DuplicateAlertCheck(Duration duplicateWindow, double valueTolerance, double contextMatchRatio) {
        this.duplicateWindow = duplicateWindow;
        this.valueTolerance = valueTolerance;
        this.contextMatchRatio = contextMatchRatio;
    }

    @Override
    public String name() {
        return "duplicate_alert";
    }

    @Override
    public Optional<SuppressionResult> check(SuppressionContext context) {
        Alert candidate = context.getAlert();
        List<Alert> duplicates = context.ruleAlertsWithin(candidate.getAlertRuleId(), duplicateWindow).stream()
                .filter(previous -> isDuplicate(candidate, previous))
                .collect(Collectors.toList());

        if (duplicates.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("duplicateCount", duplicates.size());
        metadata.put("windowMinutes", duplicateWindow.toMinutes());
        duplicates.stream()
                .max(Comparator.comparing(Alert::getCreatedAt))
                .ifPresent(latest -> metadata.put("mostRecentDuplicate", latest.getId()));

        return Optional.of(SuppressionResult.suppressed(SuppressionReason.DUPLICATE_ALERT,
                        context.getNow().plus(duplicateWindow), metadata)
                .toBuilder()
                .relatedAlerts(duplicates.stream().map(Alert::getId).collect(Collectors.toList()))
                .build());
    }

    boolean isDuplicate(Alert candidate, Alert previous) {
        if (candidate.hasMetricValue() && previous.hasMetricValue()) {
            double tolerance = Math.abs(candidate.getMetricValue() * valueTolerance);
            if (Math.abs(previous.getMetricValue() - candidate.getMetricValue()) <= tolerance) {
                return true;
            }
        }
        return contextMatches(candidate.getContext(), previous.getContext());
    }

    private boolean contextMatches(Map<String, Object> current, Map<String, Object> previous) {
        if (current == null || previous == null) {
            return false;
        }

        Set<String> commonKeys = previous.keySet().stream()
                .filter(current::containsKey)
                .collect(Collectors.toSet());
        if (commonKeys.isEmpty()) {
            return false;
        }

        long matching = commonKeys.stream()
                .filter(key -> Objects.equals(previous.get(key), current.get(key)))
                .count();
        return (double) matching / commonKeys.size() >= contextMatchRatio;
    }
}
