package alertsuppression.suppression.condition;

import alertsuppression.suppression.AlertSeverity;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 将存储中的 conditions 映射解析为类型化条件。
 * 空值条件被忽略；无法解析的条件转为 {@link MalformedCondition}，不影响其它条件。
 */
public final class RuleConditionParser {
    private static final Logger logger = LoggerFactory.getLogger(RuleConditionParser.class);

    private RuleConditionParser() {
    }

    public static List<RuleCondition> parse(Map<String, Object> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return Collections.emptyList();
        }

        List<RuleCondition> parsed = new ArrayList<>();
        for (Map.Entry<String, Object> entry : conditions.entrySet()) {
            Optional<ConditionKind> kind = ConditionKind.fromKey(entry.getKey());
            if (kind.isEmpty()) {
                logger.debug("忽略未知的规则条件: {}", entry.getKey());
                continue;
            }

            try {
                RuleCondition condition = parseCondition(kind.get(), entry.getValue());
                if (condition != null) {
                    parsed.add(condition);
                }
            } catch (RuntimeException e) {
                logger.warn("规则条件解析失败: {}={}, {}", entry.getKey(), entry.getValue(), e.getMessage());
                parsed.add(new MalformedCondition(entry.getKey(), entry.getValue(), e.getMessage()));
            }
        }
        return parsed;
    }

    private static RuleCondition parseCondition(ConditionKind kind, Object value) {
        if (value == null) {
            return null;
        }

        switch (kind) {
            case METRIC_NAME:
                String metricName = asString(value);
                return StringUtils.isEmpty(metricName) ? null : new MetricNameCondition(metricName);
            case SEVERITY_SET:
                return new SeveritySetCondition(parseSeverities(value));
            case WINDOW_COUNT:
                int minutes = parseMinutes(value);
                return minutes == 0 ? null : new WindowCountCondition(minutes);
            case REQUIRED_TAGS:
                return new RequiredTagsCondition(parseStringSet(value));
            default:
                throw new IllegalArgumentException("不支持的条件类型: " + kind);
        }
    }

    private static String asString(Object value) {
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("期望字符串类型: " + value);
        }
        return (String) value;
    }

    private static Set<AlertSeverity> parseSeverities(Object value) {
        Set<AlertSeverity> severities = EnumSet.noneOf(AlertSeverity.class);
        for (String severity : parseStringSet(value)) {
            AlertSeverity parsed = AlertSeverity.fromString(severity);
            if (parsed != null) {
                severities.add(parsed);
            }
        }
        return severities;
    }

    private static int parseMinutes(Object value) {
        long minutes;
        if (value instanceof Number) {
            minutes = ((Number) value).longValue();
        } else if (value instanceof String) {
            minutes = Long.parseLong(((String) value).trim());
        } else {
            throw new IllegalArgumentException("无效的时间窗口: " + value);
        }
        if (minutes < 0 || minutes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("时间窗口超出范围: " + minutes);
        }
        return (int) minutes;
    }

    private static Set<String> parseStringSet(Object value) {
        if (value instanceof String) {
            return Collections.singleton((String) value);
        }
        if (!(value instanceof Collection)) {
            throw new IllegalArgumentException("期望列表类型: " + value);
        }

        Set<String> values = new LinkedHashSet<>();
        for (Object item : (Collection<?>) value) {
            values.add(asString(item));
        }
        return values;
    }
}
