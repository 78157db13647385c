package alertsuppression.suppression.audit;

import alertsuppression.config.SuppressionSettings;
import alertsuppression.suppression.AuditWriteException;
import alertsuppression.suppression.SuppressionException;
import alertsuppression.utils.RetryUtils;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 审计记录批量写入 Elasticsearch
 * <p>
 * 记录先进入有界队列，由后台任务按 bulkSize 批量写出；批量失败的记录逐条重试。
 * 队列满时直接提交到 IO 线程池单条写入。
 */
public class ESAuditSink implements AuditSink {
    private static final Logger logger = LoggerFactory.getLogger(ESAuditSink.class);

    private final ElasticsearchClient esClient;
    private final SuppressionSettings settings;
    private final Executor ioExecutor;
    private final BlockingQueue<SuppressionAuditRecord> pendingRecords;
    private final ScheduledExecutorService flushExecutor;

    public ESAuditSink(ElasticsearchClient esClient, SuppressionSettings settings, Executor ioExecutor) {
        this.esClient = esClient;
        this.settings = settings;
        this.ioExecutor = ioExecutor;
        this.pendingRecords = new LinkedBlockingQueue<>(settings.getAuditQueueCapacity());
        this.flushExecutor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("suppression-audit-%d").setDaemon(true).build());
    }

    /**
     * 启动定期刷新
     */
    public void start() {
        long intervalMillis = settings.getAuditFlushInterval().toMillis();
        flushExecutor.scheduleWithFixedDelay(this::flushSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void record(SuppressionAuditRecord record) {
        if (pendingRecords.offer(record)) {
            if (pendingRecords.size() >= settings.getAuditBulkSize()) {
                submitFlush();
            }
            return;
        }

        logger.warn("审计队列已满，直接写入: {}", record.getAlertId());
        try {
            ioExecutor.execute(() -> writeWithRetry(record));
        } catch (RejectedExecutionException e) {
            logger.error("审计记录丢弃", new AuditWriteException("IO线程池已满，无法写入审计记录: " + record.getAlertId(), e));
        }
    }

    /**
     * 写出队列中所有记录
     */
    public void flush() {
        while (!pendingRecords.isEmpty()) {
            List<SuppressionAuditRecord> records = new ArrayList<>();
            pendingRecords.drainTo(records, settings.getAuditBulkSize());
            if (records.isEmpty()) {
                return;
            }
            writeBulk(records);
        }
    }

    public int pendingCount() {
        return pendingRecords.size();
    }

    @Override
    public void shutdown() {
        try {
            flushExecutor.shutdown();
            if (!flushExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                flushExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            flushExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        // 最终刷新
        flush();
    }

    private void submitFlush() {
        try {
            flushExecutor.execute(this::flushSafely);
        } catch (RejectedExecutionException e) {
            logger.debug("审计刷新任务已停止，等待关闭时写出");
        }
    }

    private void flushSafely() {
        try {
            flush();
        } catch (Exception e) {
            logger.error("刷新审计记录失败", e);
        }
    }

    private void writeBulk(List<SuppressionAuditRecord> records) {
        List<SuppressionAuditRecord> failed = new ArrayList<>();
        try {
            BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
            for (SuppressionAuditRecord record : records) {
                bulkBuilder.operations(op -> op
                        .index(idx -> idx
                                .index(settings.getAuditIndex())
                                .id(record.getId())
                                .document(record)
                        )
                );
            }

            BulkResponse response = esClient.bulk(bulkBuilder.build());
            if (response.errors()) {
                List<BulkResponseItem> items = response.items();
                for (int i = 0; i < items.size() && i < records.size(); i++) {
                    if (items.get(i).error() != null) {
                        failed.add(records.get(i));
                    }
                }
                logger.error("批量写入审计记录部分失败: {}/{}", failed.size(), records.size());
            }
        } catch (Exception e) {
            logger.error("批量写入审计记录异常", e);
            failed = records;
        }

        // 重试失败的记录
        for (SuppressionAuditRecord record : failed) {
            writeWithRetry(record);
        }
    }

    private void writeWithRetry(SuppressionAuditRecord record) {
        try {
            RetryUtils.withRetry("写入审计记录 " + record.getAlertId(),
                    settings.getAuditMaxAttempts(), settings.getStoreRetryBackoff(),
                    () -> writeRecord(record));
        } catch (SuppressionException e) {
            logger.error("审计记录写入失败: {}", record.getAlertId(), e);
        }
    }

    private IndexResponse writeRecord(SuppressionAuditRecord record) {
        try {
            return esClient.index(IndexRequest.of(i -> i
                    .index(settings.getAuditIndex())
                    .id(record.getId())
                    .document(record)
            ));
        } catch (IOException | RuntimeException e) {
            throw new AuditWriteException("写入审计记录失败: " + record.getId(), e);
        }
    }
}
