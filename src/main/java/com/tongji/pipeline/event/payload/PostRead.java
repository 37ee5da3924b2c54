package com.tongji.pipeline.event.payload;

import com.tongji.pipeline.event.EventType;
import jakarta.validation.constraints.NotBlank;

/**
 * 阅读事件（从未读 Feed 中移除）。
 */
public record PostRead(
        @NotBlank(message = "userId 不能为空") String userId,
        @NotBlank(message = "postId 不能为空") String postId) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.POST_READ;
    }
}
