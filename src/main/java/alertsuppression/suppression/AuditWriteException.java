package alertsuppression.suppression;

/**
 * 抑制决策审计写入失败
 */
public class AuditWriteException extends SuppressionException {
    public AuditWriteException(String message) {
        super(message);
    }

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
