package com.tongji.pipeline.log;

/**
 * 死信出口：超出重试预算或无法解析的记录转入此处，避免阻塞分区。
 */
public interface DeadLetterSink {
    /**
     * 投递死信。
     * @param record 原始记录
     * @param reason 失败原因
     * @param attempts 已尝试次数
     * @throws EventLogException 投递失败
     */
    void send(LogRecord record, String reason, int attempts);
}
