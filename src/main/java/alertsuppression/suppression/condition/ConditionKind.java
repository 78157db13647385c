package alertsuppression.suppression.condition;

import java.util.Optional;

/**
 * 自定义规则条件类型，key 为规则 conditions 中的字段名
 */
public enum ConditionKind {
    METRIC_NAME("metric_name"),
    SEVERITY_SET("severity"),
    WINDOW_COUNT("time_window_minutes"),
    REQUIRED_TAGS("required_tags"),
    MALFORMED(null);

    private final String key;

    ConditionKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<ConditionKind> fromKey(String key) {
        for (ConditionKind kind : values()) {
            if (kind.key != null && kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
