package com.tongji.pipeline.event;

import com.tongji.pipeline.common.exception.EventValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 事件 Schema 校验：Bean Validation 约束 + 信封类型与负载变体一致性。
 */
@Component
public class EventValidator {
    private final Validator validator;

    public EventValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * 校验事件，返回全部违规描述（为空表示合法）。
     * @param event 待校验事件
     * @return 违规列表
     */
    public List<String> violations(DomainEvent event) {
        if (event == null) {
            return List.of("event 不能为空");
        }
        List<String> out = new ArrayList<>();
        Set<ConstraintViolation<DomainEvent>> found = validator.validate(event);
        found.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> out.add(v.getPropertyPath() + ": " + v.getMessage()));
        if (event.eventType() != null && event.payload() != null
                && event.payload().eventType() != event.eventType()) {
            out.add("eventType " + event.eventType() + " 与负载类型 " + event.payload().eventType() + " 不一致");
        }
        return out;
    }

    /**
     * 校验事件，不合法时抛出 {@link EventValidationException}。
     * @param event 待校验事件
     * @return 原事件
     */
    public DomainEvent requireValid(DomainEvent event) {
        List<String> v = violations(event);
        if (!v.isEmpty()) {
            throw new EventValidationException(v);
        }
        return event;
    }
}
