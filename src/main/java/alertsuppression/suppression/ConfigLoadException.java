package alertsuppression.suppression;

/**
 * 规则/维护窗口/历史告警加载失败
 */
public class ConfigLoadException extends SuppressionException {
    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
