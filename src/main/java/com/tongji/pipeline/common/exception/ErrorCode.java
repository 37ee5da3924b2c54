package com.tongji.pipeline.common.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    EVENT_INVALID("EVENT_INVALID", "事件校验失败"),
    EVENT_PUBLISH_FAILED("EVENT_PUBLISH_FAILED", "事件投递失败"),
    CURSOR_INVALID("CURSOR_INVALID", "分页游标无效"),
    BAD_REQUEST("BAD_REQUEST", "请求参数错误"),
    INTERNAL_ERROR("INTERNAL_ERROR", "服务器内部错误");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
