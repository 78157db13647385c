package alertsuppression.suppression.cache;

import alertsuppression.suppression.SuppressionResult;
import lombok.Data;

import java.time.Instant;

@Data
public class CachedDecision {
    private final SuppressionResult result;
    private final Instant cachedAt;
}
