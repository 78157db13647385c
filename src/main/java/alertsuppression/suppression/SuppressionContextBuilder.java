package alertsuppression.suppression;

import alertsuppression.config.SuppressionSettings;
import alertsuppression.suppression.store.SuppressionStore;
import alertsuppression.utils.RetryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 并行加载历史告警、抑制规则和生效的维护窗口
 * <p>
 * 三项加载共用一个截止时间，超时的加载被中断；单项失败时以空集继续评估。
 */
public class SuppressionContextBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SuppressionContextBuilder.class);

    private final SuppressionStore store;
    private final SuppressionSettings settings;
    private final ExecutorService ioExecutor;

    public SuppressionContextBuilder(SuppressionStore store, SuppressionSettings settings, ExecutorService ioExecutor) {
        this.store = store;
        this.settings = settings;
        this.ioExecutor = ioExecutor;
    }

    public SuppressionContext build(Alert alert, AlertRule rule, Instant now) {
        Instant historyStart = now.minus(settings.getHistoryWindow());
        long deadline = System.nanoTime() + settings.getStoreTimeout().toNanos();

        Future<List<Alert>> recentAlerts =
                load("历史告警", () -> store.findAlertsCreatedAfter(historyStart, alert.getTeamId()));
        Future<List<SuppressionRule>> suppressionRules =
                load("抑制规则", store::findEnabledSuppressionRules);
        Future<List<MaintenanceWindow>> maintenanceWindows =
                load("维护窗口", () -> store.findActiveMaintenanceWindows(now));

        // 排除告警自身
        List<Alert> history = await(recentAlerts, "历史告警", deadline).stream()
                .filter(a -> !Objects.equals(a.getId(), alert.getId()))
                .collect(Collectors.toList());

        return SuppressionContext.builder()
                .alert(alert)
                .rule(rule)
                .now(now)
                .recentAlerts(history)
                .activeSuppressions(await(suppressionRules, "抑制规则", deadline))
                .maintenanceWindows(await(maintenanceWindows, "维护窗口", deadline))
                .build();
    }

    private <T> Future<List<T>> load(String name, Supplier<List<T>> loader) {
        try {
            return ioExecutor.submit(() -> RetryUtils.withRetry("加载" + name,
                    settings.getStoreMaxAttempts(), settings.getStoreRetryBackoff(), loader));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> List<T> await(Future<List<T>> future, String name, long deadline) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            List<T> result = future.get(remaining, TimeUnit.NANOSECONDS);
            return result != null ? result : Collections.emptyList();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logLoadFailure(name, e);
        } catch (ExecutionException e) {
            logLoadFailure(name, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            future.cancel(true);
            logLoadFailure(name, e);
        }
        return Collections.emptyList();
    }

    private void logLoadFailure(String name, Throwable cause) {
        ConfigLoadException error = cause instanceof ConfigLoadException
                ? (ConfigLoadException) cause
                : new ConfigLoadException(name + "加载失败", cause);
        logger.warn("{}加载失败，按空集继续评估", name, error);
    }
}
