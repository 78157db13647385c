package alertsuppression.suppression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * 告警级别
 */
public enum AlertSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertSeverity fromString(String severity) {
        if (StringUtils.isBlank(severity)) {
            return null;
        }
        try {
            return valueOf(severity.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的告警级别: " + severity, e);
        }
    }

    public boolean isHighSeverity() {
        return this == CRITICAL || this == HIGH;
    }

    public boolean isLowSeverity() {
        return this == LOW || this == INFO;
    }
}
