package alertsuppression.suppression;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * 抑制引擎运行统计
 */
@Data
@Builder
public class SuppressionStatistics {
    private final int activeGroups;
    private final long cacheSize;
    private final int suppressionRules;
    private final int maintenanceWindows;
    private final long totalEvaluations;
    private final long totalSuppressed;
    private final long totalAllowed;
    private final long cacheHits;
    private final Map<String, Long> reasonCounts;
    private final Instant lastEvaluationTime;
    private final Instant lastConfigRefresh;
}
