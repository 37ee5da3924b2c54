package com.tongji.pipeline.common.exception;

import java.util.List;

/**
 * 领域事件未通过 Schema 校验。不会自动重试，直接反馈给调用方。
 */
public class EventValidationException extends BusinessException {

    private final List<String> violations;

    public EventValidationException(List<String> violations) {
        super(ErrorCode.EVENT_INVALID, ErrorCode.EVENT_INVALID.getDefaultMessage() + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
