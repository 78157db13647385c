package alertsuppression.suppression.cache;

import alertsuppression.config.SuppressionSettings;
import alertsuppression.suppression.Alert;
import alertsuppression.suppression.AlertRule;
import alertsuppression.suppression.CacheCorruptionException;
import alertsuppression.suppression.SuppressionResult;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 本地决策缓存，写入后 TTL 过期
 * <p>
 * 键包含告警 id，只有同一告警在同一时间桶内的重复评估会命中；没有 id 的告警不缓存。
 */
@Slf4j
public class LocalDecisionCache implements DecisionCache {
    private final Cache<String, CachedDecision> cache;
    private final long bucketMillis;

    public LocalDecisionCache(SuppressionSettings settings) {
        this(settings, Ticker.systemTicker());
    }

    LocalDecisionCache(SuppressionSettings settings, Ticker ticker) {
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(settings.getCacheTtl().toMillis(), TimeUnit.MILLISECONDS)
                .maximumSize(settings.getCacheMaxSize())
                .ticker(ticker)
                .build();
        this.bucketMillis = Math.max(1, settings.getCacheBucket().toMillis());
    }

    @Override
    public Optional<SuppressionResult> get(Alert alert, AlertRule rule, Instant now) {
        if (StringUtils.isEmpty(alert.getId())) {
            return Optional.empty();
        }
        String key = cacheKey(alert, rule, now);
        CachedDecision entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(validate(key, entry));
        } catch (CacheCorruptionException e) {
            log.warn("决策缓存记录损坏，已删除: {}", e.getMessage());
            cache.invalidate(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(Alert alert, AlertRule rule, Instant now, SuppressionResult result) {
        if (StringUtils.isEmpty(alert.getId())) {
            return;
        }
        cache.put(cacheKey(alert, rule, now), new CachedDecision(result, now));
    }

    @Override
    public long size() {
        return cache.size();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public void shutdown() {
        cache.invalidateAll();
    }

    /**
     * md5(告警|规则|指标|级别|时间桶)
     */
    String cacheKey(Alert alert, AlertRule rule, Instant now) {
        long bucket = now.toEpochMilli() / bucketMillis;
        String ruleId = rule != null ? rule.getId() : alert.getAlertRuleId();
        String severity = alert.getSeverity() != null ? alert.getSeverity().code() : "";
        return DigestUtils.md5Hex(alert.getId() + "|" + ruleId + "|" + alert.getMetricName() + "|" + severity + "|" + bucket);
    }

    private SuppressionResult validate(String key, CachedDecision entry) {
        SuppressionResult result = entry.getResult();
        if (result == null || result.getReason() == null || entry.getCachedAt() == null) {
            throw new CacheCorruptionException("缓存记录不完整: " + key);
        }
        return result;
    }
}
