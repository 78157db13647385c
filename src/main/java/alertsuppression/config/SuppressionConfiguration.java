package alertsuppression.config;

import alertsuppression.suppression.AlertSuppressionManager;
import alertsuppression.suppression.audit.ESAuditSink;
import alertsuppression.suppression.cache.DecisionCache;
import alertsuppression.suppression.cache.LocalDecisionCache;
import alertsuppression.suppression.store.ESSuppressionStore;
import alertsuppression.suppression.store.SuppressionStore;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.RestClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class SuppressionConfiguration {

    @Autowired
    private ConfigFilePathManage configFilePathManage;

    @Bean
    public SuppressionConfig suppressionConfig() {
        log.info("加载抑制引擎配置: {}", configFilePathManage.suppressionConfigPath);
        return SuppressionConfig.load(configFilePathManage.suppressionConfigPath);
    }

    @Bean
    public SuppressionSettings suppressionSettings(SuppressionConfig suppressionConfig) {
        return SuppressionSettings.from(suppressionConfig);
    }

    @Bean
    public Clock suppressionClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public RestClient restClient(SuppressionConfig suppressionConfig) {
        return ElasticsearchClientFactory.createRestClient(suppressionConfig);
    }

    @Bean
    public ElasticsearchClient elasticsearchClient(RestClient restClient) {
        return ElasticsearchClientFactory.createEsClient(restClient);
    }

    /**
     * 存储查询与审计写入共用的IO线程池
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolExecutor suppressionIoExecutor(SuppressionSettings settings) {
        return new ThreadPoolExecutor(
                settings.getIoCoreSize(),
                settings.getIoMaxSize(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(settings.getIoQueueCapacity()),
                new ThreadFactoryBuilder().setNameFormat("suppression-io-%d").build(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean
    public SuppressionStore suppressionStore(ElasticsearchClient elasticsearchClient, SuppressionSettings settings) {
        return new ESSuppressionStore(elasticsearchClient, settings);
    }

    @Bean(initMethod = "start", destroyMethod = "")
    public ESAuditSink auditSink(ElasticsearchClient elasticsearchClient, SuppressionSettings settings,
                                 ThreadPoolExecutor suppressionIoExecutor) {
        return new ESAuditSink(elasticsearchClient, settings, suppressionIoExecutor);
    }

    @Bean(destroyMethod = "")
    public DecisionCache decisionCache(SuppressionSettings settings) {
        return new LocalDecisionCache(settings);
    }

    /**
     * 关闭时由管理器负责关闭审计和缓存
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public AlertSuppressionManager alertSuppressionManager(SuppressionSettings settings,
                                                           SuppressionStore suppressionStore,
                                                           ESAuditSink auditSink,
                                                           DecisionCache decisionCache,
                                                           Clock suppressionClock,
                                                           ThreadPoolExecutor suppressionIoExecutor) {
        return new AlertSuppressionManager(settings, suppressionStore, auditSink, decisionCache,
                suppressionClock, suppressionIoExecutor);
    }
}
