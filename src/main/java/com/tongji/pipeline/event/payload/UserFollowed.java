package com.tongji.pipeline.event.payload;

import com.tongji.pipeline.event.EventType;
import jakarta.validation.constraints.NotBlank;

/**
 * 关注事件：subject 关注 object。
 */
public record UserFollowed(
        @NotBlank(message = "subjectId 不能为空") String subjectId,
        @NotBlank(message = "objectId 不能为空") String objectId) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.USER_FOLLOWED;
    }
}
