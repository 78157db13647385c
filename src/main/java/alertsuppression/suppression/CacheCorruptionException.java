package alertsuppression.suppression;

/**
 * 决策缓存条目损坏
 */
public class CacheCorruptionException extends SuppressionException {
    public CacheCorruptionException(String message) {
        super(message);
    }
}
