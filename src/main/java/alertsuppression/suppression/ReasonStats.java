package alertsuppression.suppression;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 决策计数
 */
public class ReasonStats {
    private final AtomicLong evaluations = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();
    private final AtomicLong allowed = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final Map<SuppressionReason, AtomicLong> byReason = new EnumMap<>(SuppressionReason.class);

    public ReasonStats() {
        for (SuppressionReason reason : SuppressionReason.values()) {
            byReason.put(reason, new AtomicLong());
        }
    }

    public void record(SuppressionResult result, boolean cached) {
        evaluations.incrementAndGet();
        if (result.isShouldSuppress()) {
            suppressed.incrementAndGet();
        } else {
            allowed.incrementAndGet();
        }
        if (cached) {
            cacheHits.incrementAndGet();
        }
        byReason.get(result.getReason()).incrementAndGet();
    }

    public long getEvaluations() {
        return evaluations.get();
    }

    public long getSuppressed() {
        return suppressed.get();
    }

    public long getAllowed() {
        return allowed.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    /**
     * 按原因编码输出，只包含出现过的原因
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> counts = new LinkedHashMap<>();
        byReason.forEach((reason, count) -> {
            if (count.get() > 0) {
                counts.put(reason.code(), count.get());
            }
        });
        return counts;
    }
}
