package alertsuppression.suppression.check;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.AlertSeverity;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static alertsuppression.suppression.SuppressionFixtures.alert;
import static alertsuppression.suppression.SuppressionFixtures.context;
import static alertsuppression.suppression.SuppressionFixtures.minutesAgo;
import static alertsuppression.suppression.SuppressionFixtures.minutesLater;
import static org.assertj.core.api.Assertions.assertThat;

class SeverityThresholdCheckTest {

    private final SeverityThresholdCheck check =
            new SeverityThresholdCheck(Duration.ofMinutes(30), 5, Duration.ofMinutes(30));

    @Test
    @DisplayName("高级别告警爆发时抑制INFO告警")
    void suppressesInfoDuringStorm() {
        Optional<SuppressionResult> result = check.check(context(alert("info").severity(AlertSeverity.INFO).build())
                .recentAlerts(highSeverityStorm(5))
                .build());

        assertThat(result).isPresent();
        assertThat(result.get().getReason()).isEqualTo(SuppressionReason.HIGH_SEVERITY_THRESHOLD);
        assertThat(result.get().getSuppressUntil()).isEqualTo(minutesLater(30));
        assertThat(result.get().getMetadata()).containsEntry("highSeverityCount", 5L);
    }

    @Test
    @DisplayName("CRITICAL告警不受影响")
    void criticalNotSuppressed() {
        assertThat(check.check(context(alert("crit").severity(AlertSeverity.CRITICAL).build())
                .recentAlerts(highSeverityStorm(5))
                .build()))
                .isEmpty();
    }

    @Test
    @DisplayName("MEDIUM告警不属于低级别")
    void mediumNotSuppressed() {
        assertThat(check.check(context(alert("med").severity(AlertSeverity.MEDIUM).build())
                .recentAlerts(highSeverityStorm(6))
                .build()))
                .isEmpty();
    }

    @Test
    @DisplayName("未达到数量或超出窗口的高级别告警不触发")
    void belowThreshold() {
        List<Alert> history = new ArrayList<>(highSeverityStorm(4));
        history.add(alert("old").severity(AlertSeverity.HIGH).createdAt(minutesAgo(31)).build());

        assertThat(check.check(context(alert("low").severity(AlertSeverity.LOW).build())
                .recentAlerts(history)
                .build()))
                .isEmpty();
    }

    private static List<Alert> highSeverityStorm(int count) {
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            alerts.add(alert("h" + i)
                    .alertRuleId("rule-" + i)
                    .severity(i % 2 == 0 ? AlertSeverity.CRITICAL : AlertSeverity.HIGH)
                    .createdAt(minutesAgo(i + 1))
                    .build());
        }
        return alerts;
    }
}
