package com.tongji.pipeline.log;

import java.nio.charset.StandardCharsets;

/**
 * 从事件日志读取的记录。
 *
 * @param partitionKey  分区键
 * @param data          记录字节
 * @param sequenceToken 记录位置标识（分区-偏移），用于失败上报与重投
 */
public record LogRecord(String partitionKey, byte[] data, String sequenceToken) {

    public String text() {
        return data == null ? "" : new String(data, StandardCharsets.UTF_8);
    }
}
