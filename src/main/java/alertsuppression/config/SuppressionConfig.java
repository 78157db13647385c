package alertsuppression.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.lang3.StringUtils;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 抑制引擎配置 - YAML文件，支持点号分隔的多级key
 */
public class SuppressionConfig {
    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final Map<String, Object> config;

    private SuppressionConfig(Map<String, Object> config) {
        this.config = config;
    }

    /**
     * 加载配置文件，文件不存在时从classpath查找
     */
    @SuppressWarnings("unchecked")
    public static SuppressionConfig load(String configPath) {
        try {
            if (!configPath.startsWith(CLASSPATH_PREFIX)) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return new SuppressionConfig(yamlMapper.readValue(path.toAbsolutePath().toFile(), Map.class));
                }
            }

            String resource = StringUtils.removeStart(configPath, CLASSPATH_PREFIX);
            try (InputStream in = SuppressionConfig.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IllegalArgumentException("配置文件不存在: " + configPath);
                }
                return new SuppressionConfig(yamlMapper.readValue(in, Map.class));
            }
        } catch (Exception e) {
            throw new RuntimeException("加载配置文件失败: " + configPath, e);
        }
    }

    public static SuppressionConfig of(Map<String, Object> config) {
        return new SuppressionConfig(config != null ? config : new HashMap<>());
    }

    public static SuppressionConfig empty() {
        return of(new HashMap<>());
    }

    /**
     * 获取字符串配置
     */
    public String getString(String key, String defaultValue) {
        Object value = getValue(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * 获取整数配置
     */
    public int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * 获取布尔配置
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = getValue(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * 获取时间周期配置，支持 "30m"/"2h"/"500ms" 或 {"minutes": 30}，纯数字按分钟计
     */
    public Duration getDuration(String key, Duration defaultValue) {
        Object value = getValue(key);
        if (value == null) {
            return defaultValue;
        }
        return parseDuration(value);
    }

    /**
     * 获取配置值
     */
    @SuppressWarnings("unchecked")
    private Object getValue(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }

        String[] parts = key.split("\\.");
        Map<String, Object> current = config;

        for (int i = 0; i < parts.length - 1; i++) {
            Object value = current.get(parts[i]);
            if (!(value instanceof Map)) {
                return null;
            }
            current = (Map<String, Object>) value;
        }

        return current.get(parts[parts.length - 1]);
    }

    /**
     * 验证Elasticsearch连接配置
     */
    public void validate() {
        validateRequired("elasticsearch.host", "Elasticsearch主机未配置");
        validateRequired("elasticsearch.port", "Elasticsearch端口未配置");
    }

    private void validateRequired(String key, String message) {
        if (getValue(key) == null) {
            throw new IllegalArgumentException(message);
        }
    }

    @SuppressWarnings("unchecked")
    static Duration parseDuration(Object value) {
        if (value instanceof Number) {
            return Duration.ofMinutes(((Number) value).longValue());
        } else if (value instanceof String) {
            return parseDurationString((String) value);
        } else if (value instanceof Map) {
            return parseDurationMap((Map<String, Object>) value);
        }
        throw new IllegalArgumentException("无效的时间周期格式: " + value);
    }

    /**
     * 解析时间周期字符串
     */
    private static Duration parseDurationString(String value) {
        String number = value.replaceAll("[^0-9]", "");
        String unit = value.replaceAll("[0-9]", "").trim();

        if (number.isEmpty()) {
            throw new IllegalArgumentException("无效的时间周期: " + value);
        }
        long amount = Long.parseLong(number);

        switch (unit.toLowerCase()) {
            case "ms":
                return Duration.ofMillis(amount);
            case "s":
                return Duration.ofSeconds(amount);
            case "":
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            default:
                throw new IllegalArgumentException("无效的时间单位: " + unit);
        }
    }

    /**
     * 解析时间周期映射
     */
    private static Duration parseDurationMap(Map<String, Object> map) {
        Duration duration = Duration.ZERO;

        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String unit = entry.getKey().toLowerCase();
            long amount = ((Number) entry.getValue()).longValue();

            switch (unit) {
                case "milliseconds":
                    duration = duration.plusMillis(amount);
                    break;
                case "seconds":
                    duration = duration.plusSeconds(amount);
                    break;
                case "minutes":
                    duration = duration.plusMinutes(amount);
                    break;
                case "hours":
                    duration = duration.plusHours(amount);
                    break;
                case "days":
                    duration = duration.plusDays(amount);
                    break;
                default:
                    throw new IllegalArgumentException("无效的时间单位: " + unit);
            }
        }

        return duration;
    }
}
