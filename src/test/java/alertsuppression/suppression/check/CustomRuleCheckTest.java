package alertsuppression.suppression.check;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.AlertSeverity;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;
import alertsuppression.suppression.SuppressionRule;
import alertsuppression.suppression.SuppressionRuleType;
import alertsuppression.suppression.condition.RuleConditionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static alertsuppression.suppression.SuppressionFixtures.alert;
import static alertsuppression.suppression.SuppressionFixtures.context;
import static alertsuppression.suppression.SuppressionFixtures.minutesAgo;
import static alertsuppression.suppression.SuppressionFixtures.minutesLater;
import static org.assertj.core.api.Assertions.assertThat;

class CustomRuleCheckTest {

    private final CustomRuleCheck check = new CustomRuleCheck();

    @Test
    @DisplayName("全部条件满足时命中并记录规则")
    void matchesAllConditions() {
        SuppressionRule rule = rule("sr-1", 5, Map.of(
                "metric_name", "cpu_usage",
                "severity", List.of("medium", "low"),
                "required_tags", List.of("env")))
                .suppressionDurationMinutes(45)
                .build();
        Alert candidate = alert("a1").tags(Map.of("env", "prod")).build();

        Optional<SuppressionResult> result = check.check(context(candidate).activeSuppressions(List.of(rule)).build());

        assertThat(result).isPresent();
        assertThat(result.get().getReason()).isEqualTo(SuppressionReason.CUSTOM_RULE_MATCHED);
        assertThat(result.get().getSuppressionRuleId()).isEqualTo("sr-1");
        assertThat(result.get().getSuppressUntil()).isEqualTo(minutesLater(45));
        assertThat(result.get().getMetadata())
                .containsEntry("ruleName", "规则sr-1")
                .containsEntry("ruleType", "custom")
                .containsEntry("suppressionMinutes", 45);
    }

    @Test
    @DisplayName("任一条件不满足则不命中")
    void failsWhenAnyConditionFails() {
        SuppressionRule rule = rule("sr-1", 5, Map.of(
                "metric_name", "cpu_usage",
                "required_tags", List.of("env", "owner")))
                .build();
        Alert candidate = alert("a1").tags(Map.of("env", "prod")).build();

        assertThat(check.check(context(candidate).activeSuppressions(List.of(rule)).build())).isEmpty();
    }

    @Test
    @DisplayName("没有条件的规则总是命中")
    void emptyConditionsMatch() {
        SuppressionRule rule = rule("sr-empty", 1, Map.of()).build();

        assertThat(check.check(context(alert("a1").build()).activeSuppressions(List.of(rule)).build()))
                .hasValueSatisfying(r -> assertThat(r.getSuppressionRuleId()).isEqualTo("sr-empty"));
    }

    @Test
    @DisplayName("按优先级从高到低，第一条命中的规则生效")
    void highestPriorityWins() {
        SuppressionRule low = rule("sr-low", 1, Map.of()).build();
        SuppressionRule high = rule("sr-high", 10, Map.of()).build();

        Optional<SuppressionResult> result = check.check(context(alert("a1").build())
                .activeSuppressions(List.of(low, high))
                .build());

        assertThat(result.get().getSuppressionRuleId()).isEqualTo("sr-high");
    }

    @Test
    @DisplayName("格式错误的规则按未命中处理，继续评估低优先级规则")
    void malformedRuleDoesNotBlockLowerPriority() {
        SuppressionRule malformed = rule("sr-bad", 10, Map.of("time_window_minutes", "abc")).build();
        SuppressionRule valid = rule("sr-good", 1, Map.of("metric_name", "cpu_usage")).build();

        Optional<SuppressionResult> result = check.check(context(alert("a1").build())
                .activeSuppressions(List.of(malformed, valid))
                .build());

        assertThat(result).isPresent();
        assertThat(result.get().getSuppressionRuleId()).isEqualTo("sr-good");
    }

    @Test
    @DisplayName("时间窗口内告警数达到规则上限时命中")
    void windowCountCondition() {
        SuppressionRule rule = rule("sr-window", 1, Map.of("time_window_minutes", 10))
                .maxAlertsPerWindow(2)
                .build();
        List<Alert> history = new ArrayList<>();
        history.add(alert("h1").alertRuleId("rule-9").createdAt(minutesAgo(3)).build());

        assertThat(check.check(context(alert("a1").build()).activeSuppressions(List.of(rule))
                .recentAlerts(history).build()))
                .isEmpty();

        history.add(alert("h2").alertRuleId("rule-8").createdAt(minutesAgo(8)).build());
        history.add(alert("h3").createdAt(minutesAgo(11)).build());

        assertThat(check.check(context(alert("a1").build()).activeSuppressions(List.of(rule))
                .recentAlerts(history).build()))
                .isPresent();
    }

    @Test
    @DisplayName("跳过禁用和其它团队的规则")
    void skipsDisabledAndOtherTeams() {
        SuppressionRule disabled = rule("sr-disabled", 10, Map.of()).enabled(false).build();
        SuppressionRule otherTeam = rule("sr-team-b", 5, Map.of()).teamId("team-b").build();
        Alert candidate = alert("a1").teamId("team-a").severity(AlertSeverity.LOW).build();

        assertThat(check.check(context(candidate).activeSuppressions(List.of(disabled, otherTeam)).build()))
                .isEmpty();
    }

    private static SuppressionRule.SuppressionRuleBuilder rule(String id, int priority, Map<String, Object> conditions) {
        return SuppressionRule.builder()
                .id(id)
                .name("规则" + id)
                .ruleType(SuppressionRuleType.CUSTOM)
                .priority(priority)
                .conditions(RuleConditionParser.parse(conditions));
    }
}
