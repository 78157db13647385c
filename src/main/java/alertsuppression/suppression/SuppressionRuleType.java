package alertsuppression.suppression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SuppressionRuleType {
    DUPLICATE,
    RATE_LIMIT,
    MAINTENANCE,
    GROUPING,
    THRESHOLD,
    CUSTOM;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SuppressionRuleType fromString(String type) {
        try {
            return valueOf(type.toUpperCase(Locale.ROOT));
        } catch (Exception e) {
            return CUSTOM;
        }
    }
}
