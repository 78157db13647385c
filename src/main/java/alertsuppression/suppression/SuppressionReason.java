package alertsuppression.suppression;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 抑制决策原因
 */
public enum SuppressionReason {
    MAINTENANCE_WINDOW("maintenance_window"),
    DUPLICATE_ALERT("duplicate_alert"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    COOLDOWN_PERIOD("cooldown_period"),
    ALERT_GROUPING("alert_grouping"),
    HIGH_SEVERITY_THRESHOLD("high_severity_threshold"),
    CUSTOM_RULE_MATCHED("custom_rule_matched"),
    NO_SUPPRESSION_APPLIED("no_suppression_applied"),
    SUPPRESSION_EVALUATION_ERROR("suppression_evaluation_error");

    private final String code;

    SuppressionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
