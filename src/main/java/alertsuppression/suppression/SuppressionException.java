package alertsuppression.suppression;

/**
 * 抑制引擎异常
 */
public class SuppressionException extends RuntimeException {
    public SuppressionException(String message) {
        super(message);
    }

    public SuppressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
