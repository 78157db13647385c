package alertsuppression.suppression.audit;

/**
 * 抑制决策审计输出，写入失败只记录日志，不影响决策
 */
public interface AuditSink {

    void record(SuppressionAuditRecord record);

    /**
     * 写出缓冲中的记录并释放资源
     */
    void shutdown();
}
