package alertsuppression.suppression;

import alertsuppression.config.SuppressionSettings;
import alertsuppression.suppression.audit.AuditSink;
import alertsuppression.suppression.audit.SuppressionAuditRecord;
import alertsuppression.suppression.cache.DecisionCache;
import alertsuppression.suppression.store.SuppressionStore;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 告警抑制管理器
 * <p>
 * 对每条新告警给出投递或抑制的决策：决策缓存 → 构建上下文 → 抑制检查链 → 写缓存 → 审计。
 * 评估过程中的任何异常都不会向调用方抛出，告警按放行处理。
 */
public class AlertSuppressionManager {
    private static final Logger logger = LoggerFactory.getLogger(AlertSuppressionManager.class);

    private final SuppressionSettings settings;
    private final SuppressionContextBuilder contextBuilder;
    private final AlertGroupingEngine groupingEngine;
    private final SuppressionPipeline pipeline;
    private final DecisionCache decisionCache;
    private final AuditSink auditSink;
    private final SuppressionRuleRegistry registry;
    private final Clock clock;
    private final ScheduledExecutorService maintenanceExecutor;

    // 决策统计
    private final ReasonStats reasonStats = new ReasonStats();
    private volatile Instant lastEvaluationTime;

    public AlertSuppressionManager(SuppressionSettings settings,
                                   SuppressionStore store,
                                   AuditSink auditSink,
                                   DecisionCache decisionCache,
                                   Clock clock,
                                   ExecutorService ioExecutor) {
        this.settings = settings;
        this.contextBuilder = new SuppressionContextBuilder(store, settings, ioExecutor);
        this.groupingEngine = new AlertGroupingEngine(settings.getGroupingWindow(), settings.getGroupingThreshold());
        this.pipeline = SuppressionPipeline.standard(settings, groupingEngine);
        this.decisionCache = decisionCache;
        this.auditSink = auditSink;
        this.registry = new SuppressionRuleRegistry(store, clock);
        this.clock = clock;
        this.maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("suppression-maintenance-%d").setDaemon(true).build());
    }

    /**
     * 加载抑制配置并启动维护任务
     */
    public void start() {
        registry.refresh();
        startMaintenanceTasks();
        logger.info("告警抑制管理器已启动, 规则 {} 条, 维护窗口 {} 个",
                registry.getRuleCount(), registry.getWindowCount());
    }

    /**
     * 评估告警是否需要抑制
     */
    public SuppressionResult evaluate(Alert alert, AlertRule rule) {
        if (alert == null) {
            return SuppressionResult.evaluationError(new EvaluationException("告警为空"));
        }

        Instant now = clock.instant();
        SuppressionResult result;
        boolean cached = false;
        try {
            Optional<SuppressionResult> cachedResult = settings.isCacheEnabled()
                    ? decisionCache.get(alert, rule, now)
                    : Optional.empty();

            if (cachedResult.isPresent()) {
                result = cachedResult.get().withMetadata("cached", true);
                cached = true;
            } else {
                SuppressionContext context = contextBuilder.build(alert, rule, now);
                result = pipeline.run(context);
                if (settings.isCacheEnabled()) {
                    decisionCache.put(alert, rule, now, result);
                }
            }
        } catch (Exception e) {
            logger.error("告警抑制评估失败，放行告警: {}", alert.getId(), e);
            result = SuppressionResult.evaluationError(e);
        }

        reasonStats.record(result, cached);
        lastEvaluationTime = now;
        logger.debug("告警 {} 评估完成: suppress={}, reason={}, cached={}",
                alert.getId(), result.isShouldSuppress(), result.getReason().code(), cached);

        audit(alert, result, now);
        return result;
    }

    /**
     * 清理过期分组并清空决策缓存
     */
    public void cleanupExpiredData() {
        Instant cutoff = clock.instant().minus(settings.getGroupRetention());
        int evicted = groupingEngine.evictOlderThan(cutoff);
        decisionCache.clear();
        logger.info("清理过期抑制数据: 删除分组 {} 个, 剩余分组 {} 个", evicted, groupingEngine.getActiveGroupCount());
    }

    public SuppressionStatistics getSuppressionStatistics() {
        return SuppressionStatistics.builder()
                .activeGroups(groupingEngine.getActiveGroupCount())
                .cacheSize(decisionCache.size())
                .suppressionRules(registry.getRuleCount())
                .maintenanceWindows(registry.getWindowCount())
                .totalEvaluations(reasonStats.getEvaluations())
                .totalSuppressed(reasonStats.getSuppressed())
                .totalAllowed(reasonStats.getAllowed())
                .cacheHits(reasonStats.getCacheHits())
                .reasonCounts(reasonStats.snapshot())
                .lastEvaluationTime(lastEvaluationTime)
                .lastConfigRefresh(registry.getLastRefreshedAt())
                .build();
    }

    /**
     * 重新加载抑制规则和维护窗口，成功时清空决策缓存
     */
    public boolean reloadSuppressionConfig() {
        boolean refreshed = registry.refresh();
        if (refreshed) {
            decisionCache.clear();
        }
        return refreshed;
    }

    /**
     * 关闭管理器
     */
    public void shutdown() {
        try {
            maintenanceExecutor.shutdown();
            if (!maintenanceExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                maintenanceExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            maintenanceExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        auditSink.shutdown();
        decisionCache.shutdown();
        logger.info("告警抑制管理器已关闭");
    }

    AlertGroupingEngine getGroupingEngine() {
        return groupingEngine;
    }

    private void audit(Alert alert, SuppressionResult result, Instant now) {
        try {
            auditSink.record(SuppressionAuditRecord.of(alert, result, now));
        } catch (Exception e) {
            logger.error("记录抑制审计失败: {}", alert.getId(), e);
        }
    }

    private void startMaintenanceTasks() {
        long housekeeping = settings.getHousekeepingInterval().toMillis();
        maintenanceExecutor.scheduleAtFixedRate(
                () -> runSafely("清理过期抑制数据", this::cleanupExpiredData),
                housekeeping,
                housekeeping,
                TimeUnit.MILLISECONDS
        );

        long refresh = settings.getRegistryRefreshInterval().toMillis();
        maintenanceExecutor.scheduleAtFixedRate(
                () -> runSafely("刷新抑制配置", registry::refresh),
                refresh,
                refresh,
                TimeUnit.MILLISECONDS
        );
    }

    // 周期任务抛出异常后会停止调度
    private void runSafely(String task, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            logger.error("{}失败", task, e);
        }
    }
}
