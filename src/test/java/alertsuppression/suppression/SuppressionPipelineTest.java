package alertsuppression.suppression;

import alertsuppression.config.SuppressionSettings;
import alertsuppression.suppression.check.SuppressionCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static alertsuppression.suppression.SuppressionFixtures.alert;
import static alertsuppression.suppression.SuppressionFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SuppressionPipelineTest {

    @Mock
    private SuppressionCheck first;
    @Mock
    private SuppressionCheck second;
    @Mock
    private SuppressionCheck third;

    @Test
    @DisplayName("第一个命中的检查决定结果，后续检查不再执行")
    void firstMatchWins() {
        SuppressionResult duplicate = SuppressionResult.suppressed(SuppressionReason.DUPLICATE_ALERT, null, Map.of());
        when(first.check(any())).thenReturn(Optional.empty());
        when(second.check(any())).thenReturn(Optional.of(duplicate));

        SuppressionResult result = new SuppressionPipeline(List.of(first, second, third))
                .run(context(alert("a1").build()).build());

        assertThat(result).isSameAs(duplicate);
        verify(third, never()).check(any());
    }

    @Test
    @DisplayName("检查抛出异常时按未命中处理并继续")
    void failingCheckIsSkipped() {
        SuppressionResult custom = SuppressionResult.suppressed(SuppressionReason.CUSTOM_RULE_MATCHED, null, Map.of());
        lenient().when(first.name()).thenReturn("broken");
        when(first.check(any())).thenThrow(new EvaluationException("检查失败"));
        when(second.check(any())).thenReturn(Optional.of(custom));

        SuppressionResult result = new SuppressionPipeline(List.of(first, second))
                .run(context(alert("a1").build()).build());

        assertThat(result.getReason()).isEqualTo(SuppressionReason.CUSTOM_RULE_MATCHED);
    }

    @Test
    @DisplayName("没有检查命中时放行")
    void noMatch() {
        when(first.check(any())).thenReturn(Optional.empty());

        SuppressionResult result = new SuppressionPipeline(List.of(first)).run(context(alert("a1").build()).build());

        assertThat(result.isShouldSuppress()).isFalse();
        assertThat(result.getReason()).isEqualTo(SuppressionReason.NO_SUPPRESSION_APPLIED);
    }

    @Test
    @DisplayName("标准检查链的顺序")
    void standardOrder() {
        SuppressionPipeline pipeline = SuppressionPipeline.standard(SuppressionSettings.defaults(),
                new AlertGroupingEngine(SuppressionSettings.defaults().getGroupingWindow(), 3));

        assertThat(pipeline.getChecks().stream().map(SuppressionCheck::name).collect(Collectors.toList()))
                .containsExactly("maintenance_window", "duplicate_alert", "rate_limit",
                        "alert_grouping", "high_severity_threshold", "custom_rules");
    }
}
