package alertsuppression.admin;

import alertsuppression.suppression.AlertSuppressionManager;
import alertsuppression.suppression.SuppressionStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

/**
 * 抑制引擎运行状态查询与配置重载
 */
@Slf4j
@RestController
@RequestMapping("/suppression")
public class SuppressionController {

    private final AlertSuppressionManager suppressionManager;

    public SuppressionController(AlertSuppressionManager suppressionManager) {
        this.suppressionManager = suppressionManager;
    }

    @GetMapping("/stats")
    public SuppressionStatistics stats() {
        return suppressionManager.getSuppressionStatistics();
    }

    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        log.info("收到抑制配置重载请求");
        boolean refreshed = suppressionManager.reloadSuppressionConfig();
        Map<String, Object> body = Collections.singletonMap("reloaded", refreshed);
        return refreshed
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
