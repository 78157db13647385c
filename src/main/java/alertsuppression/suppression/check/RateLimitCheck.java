package alertsuppression.suppression.check;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.AlertRule;
import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 规则级限流与冷却检查
 */
public class RateLimitCheck implements SuppressionCheck {
    private final Duration rateLimitWindow;

    public RateLimitCheck(Duration rateLimitWindow) {
        this.rateLimitWindow = rateLimitWindow;
    }

    @Override
    public String name() {
        return "rate_limit";
    }

    @Override
    public Optional<SuppressionResult> check(SuppressionContext context) {
        AlertRule rule = context.getRule();
        if (rule == null) {
            return Optional.empty();
        }

        List<Alert> recentAlertsForRule = context.ruleAlertsWithin(rule.getId(), rateLimitWindow);

        // maxAlertsPerHour <= 0 表示不限流
        if (rule.getMaxAlertsPerHour() > 0 && recentAlertsForRule.size() >= rule.getMaxAlertsPerHour()) {
            Instant latest = recentAlertsForRule.stream()
                    .map(Alert::getCreatedAt)
                    .max(Comparator.naturalOrder())
                    .orElse(context.getNow());
            Instant suppressUntil = latest.plus(rateLimitWindow);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("currentCount", recentAlertsForRule.size());
            metadata.put("maxAllowed", rule.getMaxAlertsPerHour());
            metadata.put("windowMinutes", rateLimitWindow.toMinutes());
            metadata.put("nextAllowedAt", suppressUntil.toString());
            return Optional.of(SuppressionResult.suppressed(SuppressionReason.RATE_LIMIT_EXCEEDED, suppressUntil, metadata));
        }

        if (rule.getCooldownMinutes() > 0) {
            Duration cooldown = Duration.ofMinutes(rule.getCooldownMinutes());
            Instant cooldownCutoff = context.getNow().minus(cooldown);
            Optional<Alert> lastInCooldown = recentAlertsForRule.stream()
                    .filter(alert -> !alert.getCreatedAt().isBefore(cooldownCutoff))
                    .max(Comparator.comparing(Alert::getCreatedAt));

            if (lastInCooldown.isPresent()) {
                Instant suppressUntil = lastInCooldown.get().getCreatedAt().plus(cooldown);

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("cooldownMinutes", rule.getCooldownMinutes());
                metadata.put("lastAlertAt", lastInCooldown.get().getCreatedAt().toString());
                metadata.put("nextAllowedAt", suppressUntil.toString());
                return Optional.of(SuppressionResult.suppressed(SuppressionReason.COOLDOWN_PERIOD, suppressUntil, metadata));
            }
        }

        return Optional.empty();
    }
}
