package com.tongji.pipeline.consumer;

import com.tongji.pipeline.log.LogRecord;

/**
 * 单条记录的处理失败。
 *
 * @param record    原始记录
 * @param reason    失败原因
 * @param retryable 是否值得重投（格式/校验错误不重试）
 */
public record RecordFailure(LogRecord record, String reason, boolean retryable) {
}
