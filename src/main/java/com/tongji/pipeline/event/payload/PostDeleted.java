package com.tongji.pipeline.event.payload;

import com.tongji.pipeline.event.EventType;
import jakarta.validation.constraints.NotBlank;

/**
 * 删帖事件。
 */
public record PostDeleted(
        @NotBlank(message = "postId 不能为空") String postId,
        @NotBlank(message = "authorId 不能为空") String authorId) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.POST_DELETED;
    }
}
