package alertsuppression.suppression;

import lombok.Builder;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * 维护窗口
 */
@Data
@Builder
public class MaintenanceWindow {
    private final String id;
    private final String name;
    private final String description;
    private final Instant startTime;
    private final Instant endTime;
    @Builder.Default
    private final Set<String> affectedSystems = Collections.emptySet();
    @Builder.Default
    private final Set<AlertSeverity> affectedSeverities = Collections.emptySet();
    private final boolean suppressAll;
    @Builder.Default
    private final boolean enabled = true;
    private final String teamId;

    /**
     * 窗口在 [startTime, endTime] 区间内生效，两端均包含
     */
    public boolean isActiveAt(Instant now) {
        return enabled
                && startTime != null && endTime != null
                && !now.isBefore(startTime)
                && !now.isAfter(endTime);
    }

    public boolean hasEnded(Instant now) {
        return endTime != null && now.isAfter(endTime);
    }

    public boolean covers(Alert alert) {
        if (StringUtils.isNotEmpty(teamId) && !teamId.equals(alert.getTeamId())) {
            return false;
        }
        return suppressAll
                || affectedSystems.contains(alert.getMetricName())
                || affectedSeverities.contains(alert.getSeverity());
    }
}
