package alertsuppression.suppression;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 抑制评估结果
 */
@Data
@Builder(toBuilder = true)
public class SuppressionResult {
    private final boolean shouldSuppress;
    private final SuppressionReason reason;
    private final Instant suppressUntil;
    private final String groupKey;
    @Builder.Default
    private final List<String> relatedAlerts = Collections.emptyList();
    @Builder.Default
    private final Map<String, Object> metadata = Collections.emptyMap();

    // 审计使用
    private final String suppressionRuleId;
    private final String maintenanceWindowId;

    public static SuppressionResult suppressed(SuppressionReason reason, Instant suppressUntil,
                                               Map<String, Object> metadata) {
        return SuppressionResult.builder()
                .shouldSuppress(true)
                .reason(reason)
                .suppressUntil(suppressUntil)
                .metadata(metadata)
                .build();
    }

    public static SuppressionResult noSuppression() {
        return SuppressionResult.builder()
                .shouldSuppress(false)
                .reason(SuppressionReason.NO_SUPPRESSION_APPLIED)
                .build();
    }

    /**
     * 评估过程异常时放行告警
     */
    public static SuppressionResult evaluationError(Throwable error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        return SuppressionResult.builder()
                .shouldSuppress(false)
                .reason(SuppressionReason.SUPPRESSION_EVALUATION_ERROR)
                .metadata(metadata)
                .build();
    }

    public SuppressionResult withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return toBuilder().metadata(merged).build();
    }
}
