package com.tongji.pipeline.log;

import java.util.List;

/**
 * 事件日志写入契约。
 */
public interface EventLogWriter {
    /**
     * 写入单条记录，等待确认。
     * @throws EventLogException 写入失败或超时
     */
    void write(String partitionKey, byte[] data);

    /**
     * 批量写入，逐条返回成败。
     * @return 与入参下标对齐的写入结果
     * @throws EventLogException 整批提交失败（如传输中断）
     */
    WriteBatchResult writeBatch(List<LogEntry> entries);
}
