package alertsuppression.suppression.store;

import alertsuppression.suppression.Alert;
import alertsuppression.suppression.MaintenanceWindow;
import alertsuppression.suppression.SuppressionRule;

import java.time.Instant;
import java.util.List;

/**
 * 告警、抑制规则与维护窗口的读取接口
 * <p>
 * 实现失败时抛出 {@link alertsuppression.suppression.ConfigLoadException}
 */
public interface SuppressionStore {

    /**
     * 查询 createdAfter 之后创建的告警，按创建时间倒序；teamId 为空时不限团队
     */
    List<Alert> findAlertsCreatedAfter(Instant createdAfter, String teamId);

    /**
     * 查询所有启用的抑制规则，按优先级倒序
     */
    List<SuppressionRule> findEnabledSuppressionRules();

    /**
     * 查询 now 时刻生效的维护窗口
     */
    List<MaintenanceWindow> findActiveMaintenanceWindows(Instant now);

    /**
     * 查询启用且尚未结束的维护窗口（含未开始的）
     */
    List<MaintenanceWindow> findPendingMaintenanceWindows(Instant now);
}
