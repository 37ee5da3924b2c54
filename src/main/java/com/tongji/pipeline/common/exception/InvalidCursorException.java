package com.tongji.pipeline.common.exception;

/**
 * 分页游标格式非法。与“未提供游标”严格区分：后者不抛异常。
 */
public class InvalidCursorException extends BusinessException {

    public InvalidCursorException(String reason) {
        super(ErrorCode.CURSOR_INVALID, "Invalid cursor: " + reason);
    }

    public InvalidCursorException(String reason, Throwable cause) {
        super(ErrorCode.CURSOR_INVALID, "Invalid cursor: " + reason, cause);
    }
}
