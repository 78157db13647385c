package alertsuppression.suppression;

/**
 * 单个抑制检查执行失败，该检查按未命中处理
 */
public class EvaluationException extends SuppressionException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
