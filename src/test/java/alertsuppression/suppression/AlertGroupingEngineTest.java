package alertsuppression.suppression;

import alertsuppression.suppression.AlertGroupingEngine.GroupingDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static alertsuppression.suppression.SuppressionFixtures.NOW;
import static alertsuppression.suppression.SuppressionFixtures.alert;
import static alertsuppression.suppression.SuppressionFixtures.minutesAgo;
import static alertsuppression.suppression.SuppressionFixtures.minutesLater;
import static org.assertj.core.api.Assertions.assertThat;

class AlertGroupingEngineTest {

    private AlertGroupingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AlertGroupingEngine(Duration.ofMinutes(15), 3);
    }

    @Test
    @DisplayName("分组键包含指标、级别、规则和排序后的上下文键")
    void groupKey() {
        Alert a = alert("a1").context(Map.of("region", "cn", "host", "db-1")).build();

        assertThat(AlertGroupingEngine.generateGroupKey(a)).isEqualTo("cpu_usage|medium|rule-1|[host,region]");
    }

    @Test
    @DisplayName("上下文取值不同但键相同的告警进入同一分组")
    void sameKeysSameGroup() {
        Alert a = alert("a1").context(Map.of("host", "db-1")).build();
        Alert b = alert("a2").context(Map.of("host", "db-2")).build();

        assertThat(AlertGroupingEngine.generateGroupKey(a)).isEqualTo(AlertGroupingEngine.generateGroupKey(b));
    }

    @Test
    @DisplayName("第四条告警起被抑制，每条告警都计入分组")
    void everyAlertAdvancesCount() {
        GroupingDecision first = engine.offer(alert("a1").createdAt(minutesAgo(10)).build(), NOW);
        assertThat(first.isSuppressed()).isFalse();
        assertThat(first.getCount()).isEqualTo(1);

        assertThat(engine.offer(alert("a2").build(), NOW).isSuppressed()).isFalse();
        assertThat(engine.offer(alert("a3").build(), NOW).isSuppressed()).isFalse();

        GroupingDecision fourth = engine.offer(alert("a4").build(), NOW);
        assertThat(fourth.isSuppressed()).isTrue();
        assertThat(fourth.getCount()).isEqualTo(4);
        assertThat(fourth.getMemberIds()).containsExactly("a1", "a2", "a3", "a4");
        assertThat(fourth.getTimeSpan()).isEqualTo(Duration.ofMinutes(10));

        GroupingDecision fifth = engine.offer(alert("a5").build(), NOW);
        assertThat(fifth.isSuppressed()).isTrue();
        assertThat(engine.getGroup(fifth.getGroupKey()).get().getCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("超过分组窗口的分组以新告警重新开始")
    void expiredGroupRestarts() {
        engine.offer(alert("a1").createdAt(minutesAgo(20)).build(), minutesAgo(20));
        engine.offer(alert("a2").createdAt(minutesAgo(19)).build(), minutesAgo(19));
        engine.offer(alert("a3").createdAt(minutesAgo(18)).build(), minutesAgo(18));

        GroupingDecision decision = engine.offer(alert("a4").build(), NOW);

        assertThat(decision.isSuppressed()).isFalse();
        assertThat(decision.getMemberIds()).containsExactly("a4");
        assertThat(decision.getFirstAlertAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("清理首条告警早于截止时间的分组")
    void evictsOldGroups() {
        engine.offer(alert("old").metricName("disk").createdAt(minutesAgo(150)).build(), minutesAgo(150));
        engine.offer(alert("new").metricName("cpu").build(), NOW);

        int evicted = engine.evictOlderThan(NOW.minus(Duration.ofHours(2)));

        assertThat(evicted).isEqualTo(1);
        assertThat(engine.getActiveGroupCount()).isEqualTo(1);
        assertThat(engine.getGroup(AlertGroupingEngine.generateGroupKey(alert("x").metricName("cpu").build())))
                .isPresent();
    }

    @Test
    @DisplayName("并发评估时计数与成员数一致")
    void concurrentOffers() throws InterruptedException {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger suppressed = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            int thread = t;
            pool.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        if (engine.offer(alert("t" + thread + "-" + i).build(), minutesLater(1)).isSuppressed()) {
                            suppressed.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        AlertGroup group = engine.getGroup(AlertGroupingEngine.generateGroupKey(alert("any").build())).get();
        assertThat(group.getCount()).isEqualTo(threads * perThread);
        assertThat(group.getAlertIds()).hasSize(threads * perThread);
        assertThat(suppressed.get()).isEqualTo(threads * perThread - 3);
    }
}
