package alertsuppression.suppression;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * 测试用告警与上下文
 */
public final class SuppressionFixtures {
    public static final Instant NOW = Instant.parse("2025-07-18T10:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private SuppressionFixtures() {
    }

    public static Instant minutesAgo(long minutes) {
        return NOW.minus(Duration.ofMinutes(minutes));
    }

    public static Instant minutesLater(long minutes) {
        return NOW.plus(Duration.ofMinutes(minutes));
    }

    public static Alert.AlertBuilder alert(String id) {
        return Alert.builder()
                .id(id)
                .alertRuleId("rule-1")
                .title("CPU使用率过高")
                .severity(AlertSeverity.MEDIUM)
                .metricName("cpu_usage")
                .createdAt(NOW);
    }

    public static AlertRule.AlertRuleBuilder rule() {
        return AlertRule.builder()
                .id("rule-1")
                .name("CPU使用率");
    }

    public static SuppressionContext.SuppressionContextBuilder context(Alert alert) {
        return SuppressionContext.builder()
                .alert(alert)
                .rule(rule().build())
                .now(NOW);
    }
}
