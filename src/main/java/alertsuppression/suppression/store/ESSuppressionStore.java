package alertsuppression.suppression.store;

import alertsuppression.config.SuppressionSettings;
import alertsuppression.suppression.Alert;
import alertsuppression.suppression.ConfigLoadException;
import alertsuppression.suppression.MaintenanceWindow;
import alertsuppression.suppression.SuppressionRule;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * 基于 Elasticsearch 的存储实现
 */
@Slf4j
public class ESSuppressionStore implements SuppressionStore {
    private static final String CREATED_AT = "created_at";
    private static final String ENABLED = "enabled";

    private final ElasticsearchClient esClient;
    private final SuppressionSettings settings;

    public ESSuppressionStore(ElasticsearchClient esClient, SuppressionSettings settings) {
        this.esClient = esClient;
        this.settings = settings;
    }

    @Override
    public List<Alert> findAlertsCreatedAfter(Instant createdAfter, String teamId) {
        try {
            SearchResponse<AlertDocument> response = esClient.search(s -> s
                            .index(settings.getAlertIndex())
                            .size(settings.getMaxQuerySize())
                            .query(q -> q
                                    .bool(b -> {
                                        b.filter(f -> f
                                                .range(r -> r
                                                        .date(d -> d.field(CREATED_AT).gte(createdAfter.toString()))
                                                )
                                        );
                                        if (StringUtils.isNotEmpty(teamId)) {
                                            b.filter(f -> f.term(t -> t.field("team_id").value(teamId)));
                                        }
                                        return b;
                                    })
                            )
                            .sort(so -> so.field(f -> f.field(CREATED_AT).order(SortOrder.Desc))),
                    AlertDocument.class);

            return toDomain(response.hits().hits(), AlertDocument::toDomain, "告警");
        } catch (Exception e) {
            throw new ConfigLoadException("查询历史告警失败: " + settings.getAlertIndex(), e);
        }
    }

    @Override
    public List<SuppressionRule> findEnabledSuppressionRules() {
        try {
            SearchResponse<SuppressionRuleDocument> response = esClient.search(s -> s
                            .index(settings.getRuleIndex())
                            .size(settings.getMaxQuerySize())
                            .query(q -> q.term(t -> t.field(ENABLED).value(true)))
                            .sort(so -> so.field(f -> f.field("priority").order(SortOrder.Desc))),
                    SuppressionRuleDocument.class);

            return toDomain(response.hits().hits(), SuppressionRuleDocument::toDomain, "抑制规则");
        } catch (Exception e) {
            throw new ConfigLoadException("加载抑制规则失败: " + settings.getRuleIndex(), e);
        }
    }

    @Override
    public List<MaintenanceWindow> findActiveMaintenanceWindows(Instant now) {
        try {
            SearchResponse<MaintenanceWindowDocument> response = esClient.search(s -> s
                            .index(settings.getWindowIndex())
                            .size(settings.getMaxQuerySize())
                            .query(q -> q
                                    .bool(b -> b
                                            .filter(f -> f.term(t -> t.field(ENABLED).value(true)))
                                            .filter(f -> f.range(r -> r.date(d -> d.field("start_time").lte(now.toString()))))
                                            .filter(f -> f.range(r -> r.date(d -> d.field("end_time").gte(now.toString()))))
                                    )
                            ),
                    MaintenanceWindowDocument.class);

            return toDomain(response.hits().hits(), MaintenanceWindowDocument::toDomain, "维护窗口");
        } catch (Exception e) {
            throw new ConfigLoadException("查询生效的维护窗口失败: " + settings.getWindowIndex(), e);
        }
    }

    @Override
    public List<MaintenanceWindow> findPendingMaintenanceWindows(Instant now) {
        try {
            SearchResponse<MaintenanceWindowDocument> response = esClient.search(s -> s
                            .index(settings.getWindowIndex())
                            .size(settings.getMaxQuerySize())
                            .query(q -> q
                                    .bool(b -> b
                                            .filter(f -> f.term(t -> t.field(ENABLED).value(true)))
                                            .filter(f -> f.range(r -> r.date(d -> d.field("end_time").gte(now.toString()))))
                                    )
                            ),
                    MaintenanceWindowDocument.class);

            return toDomain(response.hits().hits(), MaintenanceWindowDocument::toDomain, "维护窗口");
        } catch (Exception e) {
            throw new ConfigLoadException("加载维护窗口失败: " + settings.getWindowIndex(), e);
        }
    }

    /**
     * 逐条转换，格式错误的文档跳过
     */
    static <D, T> List<T> toDomain(List<Hit<D>> hits, BiFunction<D, String, T> converter, String kind) {
        List<T> result = new ArrayList<>(hits.size());
        for (Hit<D> hit : hits) {
            if (hit.source() == null) {
                continue;
            }
            try {
                result.add(converter.apply(hit.source(), hit.id()));
            } catch (RuntimeException e) {
                log.warn("跳过格式错误的{}文档: {}, {}", kind, hit.id(), e.getMessage());
            }
        }
        return result;
    }
}
