package alertsuppression.suppression;

import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 告警分组引擎 - 按 (指标, 级别, 规则, 上下文键) 聚合相关告警
 * <p>
 * 分组表的所有修改都经过 {@link ConcurrentHashMap#compute}，同一签名的并发评估串行执行；
 * 过期清理走 entrySet().removeIf，按值比较删除，与评估路径互不阻塞。
 */
public class AlertGroupingEngine {
    private static final Logger logger = LoggerFactory.getLogger(AlertGroupingEngine.class);

    private final Map<String, AlertGroup> alertGroups = new ConcurrentHashMap<>();
    private final Duration groupingWindow;
    private final int groupingThreshold;

    public AlertGroupingEngine(Duration groupingWindow, int groupingThreshold) {
        this.groupingWindow = groupingWindow;
        this.groupingThreshold = groupingThreshold;
    }

    /**
     * 将告警计入所属分组。
     * 分组在窗口内已累计 groupingThreshold 条及以上时，本条告警被抑制；
     * 窗口已过期的分组以本条告警重新开始。
     */
    public GroupingDecision offer(Alert alert, Instant now) {
        String groupKey = generateGroupKey(alert);
        AtomicReference<GroupingDecision> decision = new AtomicReference<>();

        alertGroups.compute(groupKey, (key, group) -> {
            if (group == null || group.timeSpan(now).compareTo(groupingWindow) > 0) {
                AlertGroup fresh = new AlertGroup(key, alert, firstSeenAt(alert, now));
                decision.set(GroupingDecision.of(fresh, false, now));
                return fresh;
            }

            boolean suppress = group.getCount() >= groupingThreshold;
            group.append(alert);
            decision.set(GroupingDecision.of(group, suppress, now));
            return group;
        });

        return decision.get();
    }

    /**
     * 删除首条告警早于 cutoff 的分组
     */
    public int evictOlderThan(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        alertGroups.entrySet().removeIf(entry -> {
            boolean expired = entry.getValue().isOlderThan(cutoff);
            if (expired) {
                evicted.incrementAndGet();
            }
            return expired;
        });
        if (evicted.get() > 0) {
            logger.debug("清理过期告警分组: {}", evicted.get());
        }
        return evicted.get();
    }

    public Optional<AlertGroup> getGroup(String groupKey) {
        return Optional.ofNullable(alertGroups.get(groupKey));
    }

    public int getActiveGroupCount() {
        return alertGroups.size();
    }

    /**
     * 生成分组键
     */
    public static String generateGroupKey(Alert alert) {
        Set<String> contextKeys = alert.getContext() == null
                ? Collections.emptySet()
                : new TreeSet<>(alert.getContext().keySet());

        return String.join("|",
                String.valueOf(alert.getMetricName()),
                alert.getSeverity() != null ? alert.getSeverity().code() : "",
                String.valueOf(alert.getAlertRuleId()),
                "[" + String.join(",", contextKeys) + "]");
    }

    private static Instant firstSeenAt(Alert alert, Instant now) {
        return alert.getCreatedAt() != null ? alert.getCreatedAt() : now;
    }

    /**
     * 分组快照，在 compute 内生成，外部读取无需加锁
     */
    @Data
    public static class GroupingDecision {
        private final String groupKey;
        private final boolean suppressed;
        private final List<String> memberIds;
        private final int count;
        private final Duration timeSpan;
        private final Instant firstAlertAt;
        private final Set<AlertSeverity> severities;

        static GroupingDecision of(AlertGroup group, boolean suppressed, Instant now) {
            Set<AlertSeverity> severities = group.getSeverities().isEmpty()
                    ? EnumSet.noneOf(AlertSeverity.class)
                    : EnumSet.copyOf(group.getSeverities());
            return new GroupingDecision(
                    group.getGroupKey(),
                    suppressed,
                    new ArrayList<>(group.getAlertIds()),
                    group.getCount(),
                    group.timeSpan(now),
                    group.getFirstSeenAt(),
                    severities);
        }
    }
}
