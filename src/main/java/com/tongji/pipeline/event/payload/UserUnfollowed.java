package com.tongji.pipeline.event.payload;

import com.tongji.pipeline.event.EventType;
import jakarta.validation.constraints.NotBlank;

/**
 * 取消关注事件。
 */
public record UserUnfollowed(
        @NotBlank(message = "subjectId 不能为空") String subjectId,
        @NotBlank(message = "objectId 不能为空") String objectId) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.USER_UNFOLLOWED;
    }
}
