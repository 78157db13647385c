package alertsuppression.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfigFilePathManage {

    @Value("${suppression.config.path}")
    public String suppressionConfigPath;
}
