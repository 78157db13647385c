package alertsuppression.suppression;

import alertsuppression.config.SuppressionSettings;
import alertsuppression.suppression.check.AlertGroupingCheck;
import alertsuppression.suppression.check.CustomRuleCheck;
import alertsuppression.suppression.check.DuplicateAlertCheck;
import alertsuppression.suppression.check.MaintenanceWindowCheck;
import alertsuppression.suppression.check.RateLimitCheck;
import alertsuppression.suppression.check.SeverityThresholdCheck;
import alertsuppression.suppression.check.SuppressionCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 按固定顺序执行抑制检查，第一个命中的检查决定结果
 */
public class SuppressionPipeline {
    private static final Logger logger = LoggerFactory.getLogger(SuppressionPipeline.class);

    private final List<SuppressionCheck> checks;

    public SuppressionPipeline(List<SuppressionCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    /**
     * 维护窗口 → 重复 → 限流/冷却 → 分组 → 高级别阈值 → 自定义规则
     */
    public static SuppressionPipeline standard(SuppressionSettings settings, AlertGroupingEngine groupingEngine) {
        return new SuppressionPipeline(Arrays.asList(
                new MaintenanceWindowCheck(),
                new DuplicateAlertCheck(settings.getDuplicateWindow(),
                        settings.getValueTolerance(), settings.getContextMatchRatio()),
                new RateLimitCheck(settings.getRateLimitWindow()),
                new AlertGroupingCheck(groupingEngine),
                new SeverityThresholdCheck(settings.getSeverityThresholdWindow(),
                        settings.getHighSeverityCount(), settings.getSeverityThresholdSuppression()),
                new CustomRuleCheck()));
    }

    public SuppressionResult run(SuppressionContext context) {
        String alertId = context.getAlert().getId();
        for (SuppressionCheck check : checks) {
            Optional<SuppressionResult> result;
            try {
                result = check.check(context);
            } catch (Exception e) {
                logger.warn("抑制检查 {} 执行失败，按未命中处理, alert: {}", check.name(), alertId, e);
                continue;
            }

            if (result.isPresent() && result.get().isShouldSuppress()) {
                logger.debug("告警 {} 被 {} 抑制: {}", alertId, check.name(), result.get().getReason().code());
                return result.get();
            }
        }
        return SuppressionResult.noSuppression();
    }

    public List<SuppressionCheck> getChecks() {
        return checks;
    }
}
