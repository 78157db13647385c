package alertsuppression.suppression.condition;

import alertsuppression.suppression.AlertSeverity;
import alertsuppression.suppression.EvaluationException;
import alertsuppression.suppression.SuppressionRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static alertsuppression.suppression.SuppressionFixtures.alert;
import static alertsuppression.suppression.SuppressionFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleConditionParserTest {

    @Test
    @DisplayName("解析四种条件")
    void parsesAllKinds() {
        Map<String, Object> conditions = new LinkedHashMap<>();
        conditions.put("metric_name", "cpu_usage");
        conditions.put("severity", List.of("critical", "HIGH"));
        conditions.put("time_window_minutes", "15");
        conditions.put("required_tags", List.of("env", "owner"));

        List<RuleCondition> parsed = RuleConditionParser.parse(conditions);

        assertThat(parsed).containsExactly(
                new MetricNameCondition("cpu_usage"),
                new SeveritySetCondition(EnumSet.of(AlertSeverity.CRITICAL, AlertSeverity.HIGH)),
                new WindowCountCondition(15),
                new RequiredTagsCondition(Set.of("env", "owner")));
    }

    @Test
    @DisplayName("单个字符串级别按单元素集合处理")
    void singleSeverityString() {
        assertThat(RuleConditionParser.parse(Map.of("severity", "info")))
                .containsExactly(new SeveritySetCondition(EnumSet.of(AlertSeverity.INFO)));
    }

    @Test
    @DisplayName("空值、空指标名和0分钟窗口被忽略")
    void skipsEmptyValues() {
        Map<String, Object> conditions = new HashMap<>();
        conditions.put("metric_name", "");
        conditions.put("time_window_minutes", 0);
        conditions.put("required_tags", null);

        assertThat(RuleConditionParser.parse(conditions)).isEmpty();
        assertThat(RuleConditionParser.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("未知的条件键被忽略")
    void ignoresUnknownKeys() {
        assertThat(RuleConditionParser.parse(Map.of("owner", "ops", "metric_name", "disk")))
                .containsExactly(new MetricNameCondition("disk"));
    }

    @Test
    @DisplayName("无法解析的条件转为评估时抛出异常的条件")
    void malformedConditions() {
        Map<String, Object> conditions = new LinkedHashMap<>();
        conditions.put("severity", List.of("urgent"));
        conditions.put("time_window_minutes", -5);
        conditions.put("required_tags", Arrays.asList("env", 42));
        conditions.put("metric_name", 7);

        List<RuleCondition> parsed = RuleConditionParser.parse(conditions);

        assertThat(parsed).hasSize(4).allSatisfy(condition ->
                assertThat(condition.kind()).isEqualTo(ConditionKind.MALFORMED));

        SuppressionRule rule = SuppressionRule.builder().id("sr-1").name("坏规则").build();
        assertThatThrownBy(() -> parsed.get(0).matches(rule, context(alert("a1").build()).build()))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("severity");
    }
}
