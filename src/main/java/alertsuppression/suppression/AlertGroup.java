package alertsuppression.suppression;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 同一签名下的告警分组，只在 {@link AlertGroupingEngine} 的 compute 中修改
 */
@Getter
public class AlertGroup {
    private final String groupKey;
    private final List<String> alertIds = new ArrayList<>();
    private final Set<AlertSeverity> severities = EnumSet.noneOf(AlertSeverity.class);
    private final Alert firstAlert;
    private final Instant firstSeenAt;
    private Alert lastAlert;

    AlertGroup(String groupKey, Alert firstAlert, Instant firstSeenAt) {
        this.groupKey = groupKey;
        this.firstAlert = firstAlert;
        this.firstSeenAt = firstSeenAt;
        append(firstAlert);
    }

    void append(Alert alert) {
        alertIds.add(alert.getId());
        if (alert.getSeverity() != null) {
            severities.add(alert.getSeverity());
        }
        lastAlert = alert;
    }

    public int getCount() {
        return alertIds.size();
    }

    public List<String> getAlertIds() {
        return Collections.unmodifiableList(alertIds);
    }

    public Set<AlertSeverity> getSeverities() {
        return Collections.unmodifiableSet(severities);
    }

    public Duration timeSpan(Instant now) {
        return Duration.between(firstSeenAt, now);
    }

    public boolean isOlderThan(Instant cutoff) {
        return firstSeenAt.isBefore(cutoff);
    }
}
