package com.tongji.pipeline.log;

/**
 * 事件日志传输失败（网络、Broker 不可用、超时）。属于可重试的瞬时错误。
 */
public class EventLogException extends RuntimeException {

    public EventLogException(String message) {
        super(message);
    }

    public EventLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
