package alertsuppression.config;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * 抑制引擎阈值与运行参数，未配置的项使用默认值
 */
@Data
@Builder
public class SuppressionSettings {

    // 上下文
    @Builder.Default
    private final Duration historyWindow = Duration.ofHours(2);

    // 重复告警
    @Builder.Default
    private final Duration duplicateWindow = Duration.ofMinutes(30);
    @Builder.Default
    private final double valueTolerance = 0.05;
    @Builder.Default
    private final double contextMatchRatio = 0.8;

    // 限流
    @Builder.Default
    private final Duration rateLimitWindow = Duration.ofHours(1);

    // 分组
    @Builder.Default
    private final Duration groupingWindow = Duration.ofMinutes(15);
    @Builder.Default
    private final int groupingThreshold = 3;
    @Builder.Default
    private final Duration groupRetention = Duration.ofHours(2);

    // 高级别告警阈值
    @Builder.Default
    private final Duration severityThresholdWindow = Duration.ofMinutes(30);
    @Builder.Default
    private final int highSeverityCount = 5;
    @Builder.Default
    private final Duration severityThresholdSuppression = Duration.ofMinutes(30);

    // 决策缓存
    @Builder.Default
    private final boolean cacheEnabled = true;
    @Builder.Default
    private final Duration cacheTtl = Duration.ofMinutes(5);
    @Builder.Default
    private final Duration cacheBucket = Duration.ofMinutes(1);
    @Builder.Default
    private final long cacheMaxSize = 10000;

    // 后台任务
    @Builder.Default
    private final Duration housekeepingInterval = Duration.ofMinutes(10);
    @Builder.Default
    private final Duration registryRefreshInterval = Duration.ofMinutes(5);

    // 存储
    @Builder.Default
    private final String alertIndex = "alerts";
    @Builder.Default
    private final String ruleIndex = "alert_suppression_rules";
    @Builder.Default
    private final String windowIndex = "maintenance_windows";
    @Builder.Default
    private final int maxQuerySize = 10000;
    @Builder.Default
    private final Duration storeTimeout = Duration.ofSeconds(5);
    @Builder.Default
    private final int storeMaxAttempts = 3;
    @Builder.Default
    private final Duration storeRetryBackoff = Duration.ofMillis(200);

    // 审计
    @Builder.Default
    private final String auditIndex = "alert_suppression_log";
    @Builder.Default
    private final int auditBulkSize = 100;
    @Builder.Default
    private final Duration auditFlushInterval = Duration.ofSeconds(10);
    @Builder.Default
    private final int auditQueueCapacity = 5000;
    @Builder.Default
    private final int auditMaxAttempts = 3;

    // IO线程池
    @Builder.Default
    private final int ioCoreSize = 4;
    @Builder.Default
    private final int ioMaxSize = 8;
    @Builder.Default
    private final int ioQueueCapacity = 1000;

    public static SuppressionSettings defaults() {
        return SuppressionSettings.builder().build();
    }

    public static SuppressionSettings from(SuppressionConfig config) {
        SuppressionSettings d = defaults();
        return SuppressionSettings.builder()
                .historyWindow(config.getDuration("suppression.history.window", d.historyWindow))
                .duplicateWindow(config.getDuration("suppression.duplicate.window", d.duplicateWindow))
                .valueTolerance(config.getDouble("suppression.duplicate.value_tolerance", d.valueTolerance))
                .contextMatchRatio(config.getDouble("suppression.duplicate.context_match_ratio", d.contextMatchRatio))
                .rateLimitWindow(config.getDuration("suppression.rate_limit.window", d.rateLimitWindow))
                .groupingWindow(config.getDuration("suppression.grouping.window", d.groupingWindow))
                .groupingThreshold(config.getInt("suppression.grouping.threshold", d.groupingThreshold))
                .groupRetention(config.getDuration("suppression.grouping.retention", d.groupRetention))
                .severityThresholdWindow(config.getDuration("suppression.threshold.window", d.severityThresholdWindow))
                .highSeverityCount(config.getInt("suppression.threshold.high_severity_count", d.highSeverityCount))
                .severityThresholdSuppression(config.getDuration("suppression.threshold.suppression", d.severityThresholdSuppression))
                .cacheEnabled(config.getBoolean("suppression.cache.enabled", d.cacheEnabled))
                .cacheTtl(config.getDuration("suppression.cache.ttl", d.cacheTtl))
                .cacheBucket(config.getDuration("suppression.cache.bucket", d.cacheBucket))
                .cacheMaxSize(config.getInt("suppression.cache.max_size", (int) d.cacheMaxSize))
                .housekeepingInterval(config.getDuration("suppression.housekeeping.interval", d.housekeepingInterval))
                .registryRefreshInterval(config.getDuration("suppression.registry.refresh_interval", d.registryRefreshInterval))
                .alertIndex(config.getString("store.alert_index", d.alertIndex))
                .ruleIndex(config.getString("store.rule_index", d.ruleIndex))
                .windowIndex(config.getString("store.window_index", d.windowIndex))
                .maxQuerySize(config.getInt("store.max_query_size", d.maxQuerySize))
                .storeTimeout(config.getDuration("store.timeout", d.storeTimeout))
                .storeMaxAttempts(config.getInt("store.max_attempts", d.storeMaxAttempts))
                .storeRetryBackoff(config.getDuration("store.retry_backoff", d.storeRetryBackoff))
                .auditIndex(config.getString("audit.index", d.auditIndex))
                .auditBulkSize(config.getInt("audit.bulk_size", d.auditBulkSize))
                .auditFlushInterval(config.getDuration("audit.flush_interval", d.auditFlushInterval))
                .auditQueueCapacity(config.getInt("audit.queue_capacity", d.auditQueueCapacity))
                .auditMaxAttempts(config.getInt("audit.max_attempts", d.auditMaxAttempts))
                .ioCoreSize(config.getInt("threadpool.io.core_size", d.ioCoreSize))
                .ioMaxSize(config.getInt("threadpool.io.max_size", d.ioMaxSize))
                .ioQueueCapacity(config.getInt("threadpool.io.queue_capacity", d.ioQueueCapacity))
                .build();
    }
}
