package com.tongji.pipeline.event.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tongji.pipeline.event.EventType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * 发帖事件。
 */
public record PostCreated(
        @NotBlank(message = "postId 不能为空") String postId,
        @NotBlank(message = "authorId 不能为空") String authorId,
        @NotBlank(message = "authorHandle 不能为空") String authorHandle,
        @Size(max = 2000, message = "caption 过长") String caption,
        String imageUrl,
        @JsonProperty("isPublic") boolean publicPost,
        @NotNull(message = "createdAt 不能为空") Instant createdAt) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.POST_CREATED;
    }
}
