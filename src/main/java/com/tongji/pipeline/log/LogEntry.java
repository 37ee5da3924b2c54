package com.tongji.pipeline.log;

/**
 * 待写入事件日志的记录。
 *
 * @param partitionKey 分区键（同键同分区，保证分区内有序）
 * @param data         记录字节
 */
public record LogEntry(String partitionKey, byte[] data) {
}
