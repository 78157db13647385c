package alertsuppression.suppression;

import alertsuppression.suppression.store.SuppressionStore;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 已加载的抑制规则和待执行维护窗口，定期刷新
 * <p>
 * 刷新整体替换快照，失败时保留上一次的结果。
 */
@Slf4j
public class SuppressionRuleRegistry {
    private final SuppressionStore store;
    private final Clock clock;
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public SuppressionRuleRegistry(SuppressionStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public boolean refresh() {
        Instant now = clock.instant();
        try {
            List<SuppressionRule> rules = store.findEnabledSuppressionRules();
            List<MaintenanceWindow> windows = store.findPendingMaintenanceWindows(now);
            snapshot = new Snapshot(List.copyOf(rules), List.copyOf(windows), now);
            log.info("抑制配置已刷新: 规则 {} 条, 维护窗口 {} 个", rules.size(), windows.size());
            return true;
        } catch (Exception e) {
            log.error("刷新抑制配置失败，保留上一次加载结果", e);
            return false;
        }
    }

    public int getRuleCount() {
        return snapshot.getRules().size();
    }

    public int getWindowCount() {
        return snapshot.getWindows().size();
    }

    public Instant getLastRefreshedAt() {
        return snapshot.getRefreshedAt();
    }

    @Data
    private static class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Collections.emptyList(), Collections.emptyList(), null);

        private final List<SuppressionRule> rules;
        private final List<MaintenanceWindow> windows;
        private final Instant refreshedAt;
    }
}
