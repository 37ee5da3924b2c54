package com.tongji.pipeline.common.exception;

/**
 * 事件写入事件日志失败（传输层异常的包装）。
 */
public class EventPublishException extends BusinessException {

    public EventPublishException(String eventId, Throwable cause) {
        super(ErrorCode.EVENT_PUBLISH_FAILED, "Failed to publish event " + eventId + ": " + cause.getMessage(), cause);
    }
}
