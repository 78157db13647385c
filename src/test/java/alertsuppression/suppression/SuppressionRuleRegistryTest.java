package alertsuppression.suppression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static alertsuppression.suppression.SuppressionFixtures.FIXED_CLOCK;
import static alertsuppression.suppression.SuppressionFixtures.NOW;
import static alertsuppression.suppression.SuppressionFixtures.minutesAgo;
import static alertsuppression.suppression.SuppressionFixtures.minutesLater;
import static org.assertj.core.api.Assertions.assertThat;

class SuppressionRuleRegistryTest {

    private final InMemorySuppressionStore store = new InMemorySuppressionStore();
    private final SuppressionRuleRegistry registry = new SuppressionRuleRegistry(store, FIXED_CLOCK);

    @Test
    @DisplayName("刷新前为空")
    void emptyBeforeRefresh() {
        assertThat(registry.getRuleCount()).isZero();
        assertThat(registry.getWindowCount()).isZero();
        assertThat(registry.getLastRefreshedAt()).isNull();
    }

    @Test
    @DisplayName("只统计启用的规则和未结束的维护窗口")
    void countsEnabledRulesAndPendingWindows() {
        store.addRule(SuppressionRule.builder().id("sr-1").build())
                .addRule(SuppressionRule.builder().id("sr-2").enabled(false).build())
                .addWindow(window("mw-ended", minutesAgo(120), minutesAgo(60)))
                .addWindow(window("mw-active", minutesAgo(10), minutesLater(10)))
                .addWindow(window("mw-future", minutesLater(60), minutesLater(120)));

        assertThat(registry.refresh()).isTrue();

        assertThat(registry.getRuleCount()).isEqualTo(1);
        assertThat(registry.getWindowCount()).isEqualTo(2);
        assertThat(registry.getLastRefreshedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("刷新失败时保留上一次结果")
    void failureKeepsPreviousSnapshot() {
        store.addRule(SuppressionRule.builder().id("sr-1").build());
        registry.refresh();

        store.failRuleQueries(new ConfigLoadException("索引不可用"));

        assertThat(registry.refresh()).isFalse();
        assertThat(registry.getRuleCount()).isEqualTo(1);
        assertThat(registry.getLastRefreshedAt()).isEqualTo(NOW);
    }

    private static MaintenanceWindow window(String id, Instant start, Instant end) {
        return MaintenanceWindow.builder().id(id).startTime(start).endTime(end).suppressAll(true).build();
    }
}
