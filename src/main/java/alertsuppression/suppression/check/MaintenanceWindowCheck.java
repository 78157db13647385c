package alertsuppression.suppression.check;

import alertsuppression.suppression.MaintenanceWindow;
import alertsuppression.suppression.SuppressionContext;
import alertsuppression.suppression.SuppressionReason;
import alertsuppression.suppression.SuppressionResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 维护窗口检查
 */
public class MaintenanceWindowCheck implements SuppressionCheck {

    @Override
    public String name() {
        return "maintenance_window";
    }

    @Override
    public Optional<SuppressionResult> check(SuppressionContext context) {
        for (MaintenanceWindow window : context.getMaintenanceWindows()) {
            if (!window.isActiveAt(context.getNow()) || !window.covers(context.getAlert())) {
                continue;
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("maintenanceWindow", window.getName());
            metadata.put("windowId", window.getId());
            metadata.put("endTime", window.getEndTime().toString());

            return Optional.of(SuppressionResult.suppressed(SuppressionReason.MAINTENANCE_WINDOW, window.getEndTime(), metadata)
                    .toBuilder()
                    .maintenanceWindowId(window.getId())
                    .build());
        }
        return Optional.empty();
    }
}
