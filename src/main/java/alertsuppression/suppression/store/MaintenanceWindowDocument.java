package alertsuppression.suppression.store;

import alertsuppression.suppression.AlertSeverity;
import alertsuppression.suppression.MaintenanceWindow;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * maintenance_windows 索引中的维护窗口文档
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MaintenanceWindowDocument {
    private String id;
    private String name;
    private String description;
    @JsonProperty("start_time")
    private String startTime;
    @JsonProperty("end_time")
    private String endTime;
    @JsonProperty("affected_systems")
    private List<Object> affectedSystems;
    @JsonProperty("affected_severities")
    private List<String> affectedSeverities;
    @JsonProperty("suppress_all")
    private Boolean suppressAll;
    private Boolean enabled;
    @JsonProperty("team_id")
    private String teamId;

    /**
     * @throws IllegalArgumentException 起止时间缺失或格式非法
     */
    public MaintenanceWindow toDomain(String documentId) {
        MaintenanceWindow window = MaintenanceWindow.builder()
                .id(id != null ? id : documentId)
                .name(name)
                .description(description)
                .startTime(StoreDocuments.parseTimestamp(startTime))
                .endTime(StoreDocuments.parseTimestamp(endTime))
                .affectedSystems(StoreDocuments.toStringSet(affectedSystems))
                .affectedSeverities(parseSeverities())
                .suppressAll(Boolean.TRUE.equals(suppressAll))
                .enabled(enabled == null || enabled)
                .teamId(teamId)
                .build();

        if (window.getStartTime() == null || window.getEndTime() == null) {
            throw new IllegalArgumentException("维护窗口缺少起止时间: " + window.getId());
        }
        return window;
    }

    private Set<AlertSeverity> parseSeverities() {
        Set<AlertSeverity> severities = EnumSet.noneOf(AlertSeverity.class);
        if (affectedSeverities != null) {
            for (String severity : affectedSeverities) {
                AlertSeverity parsed = AlertSeverity.fromString(severity);
                if (parsed != null) {
                    severities.add(parsed);
                }
            }
        }
        return severities;
    }
}
