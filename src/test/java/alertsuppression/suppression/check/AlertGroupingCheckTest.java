package alertsuppression.suppression.check;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.AlertGroupingEngine;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static alertsuppression.suppression.SuppressionFixtures.alert;
import static alertsuppression.suppression.SuppressionFixtures.context;
import static alertsuppression.suppression.SuppressionFixtures.minutesAgo;
import static org.assertj.core.api.Assertions.assertThat;

class AlertGroupingCheckTest {

    @Test
    @DisplayName("分组达到阈值后抑制并返回全部成员")
    void suppressesOnceThresholdReached() {
        AlertGroupingEngine engine = new AlertGroupingEngine(Duration.ofMinutes(15), 3);
        AlertGroupingCheck check = new AlertGroupingCheck(engine);

        for (int i = 1; i <= 3; i++) {
            Alert member = alert("g" + i).createdAt(minutesAgo(10 - i)).build();
            assertThat(check.check(context(member).build())).isEmpty();
        }

        Optional<SuppressionResult> result = check.check(context(alert("g4").build()).build());

        assertThat(result).isPresent();
        assertThat(result.get().getReason()).isEqualTo(SuppressionReason.ALERT_GROUPING);
        assertThat(result.get().getGroupKey()).isEqualTo(AlertGroupingEngine.generateGroupKey(alert("g4").build()));
        assertThat(result.get().getRelatedAlerts()).containsExactly("g1", "g2", "g3", "g4");
        assertThat(result.get().getSuppressUntil()).isNull();
        assertThat(result.get().getMetadata())
                .containsEntry("groupSize", 4)
                .containsEntry("groupingSeverities", List.of("medium"));
    }
}
