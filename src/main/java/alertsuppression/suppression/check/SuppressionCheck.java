package alertsuppression.suppression.check;

import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionResult;

import java.util.Optional;

/**
 * 抑制流水线中的单个检查
 */
public interface SuppressionCheck {

    String name();

    /**
     * @return 命中时返回抑制结果，未命中返回 empty
     */
    Optional<SuppressionResult> check(SuppressionContext context);
}
