package alertsuppression.utils;

import alertsuppression.suppression.SuppressionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 有限次数重试，指数退避
 */
@Slf4j
public class RetryUtils {

    private static final long MAX_BACKOFF_MILLIS = 4000;

    private RetryUtils() {
    }

    /**
     * 执行 action，失败时按 backoff 指数退避重试，达到 maxAttempts 后抛出最后一次的异常
     */
    public static <T> T withRetry(String operation, int maxAttempts, Duration backoff, Supplier<T> action) {
        int attempt = 0;
        long sleepMillis = backoff.toMillis();
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (++attempt >= Math.max(1, maxAttempts)) {
                    throw e;
                }
                log.debug("{} 第{}次失败，{}ms 后重试: {}", operation, attempt, sleepMillis, e.getMessage());
                try {
                    Thread.sleep(sleepMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SuppressionException(operation + " 重试被中断", e);
                }
                // 指数退避
                sleepMillis = Math.min(sleepMillis * 2, MAX_BACKOFF_MILLIS);
            }
        }
    }
}
