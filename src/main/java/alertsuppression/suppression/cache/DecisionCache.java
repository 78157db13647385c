package alertsuppression.suppression.cache;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.AlertRule;
import alertsuppression.suppression.SuppressionResult;

import java.time.Instant;
import java.util.Optional;

/**
 * 抑制决策缓存接口 - 同一告警在同一时间桶内重复评估时复用决策
 */
public interface DecisionCache {
    /**
     * 获取缓存的决策
     */
    Optional<SuppressionResult> get(Alert alert, AlertRule rule, Instant now);

    /**
     * 保存决策
     */
    void put(Alert alert, AlertRule rule, Instant now, SuppressionResult result);

    long size();

    /**
     * 清空缓存
     */
    void clear();

    /**
     * 关闭缓存
     */
    void shutdown();
}
