package com.tongji.pipeline.event.payload;

import com.tongji.pipeline.event.EventType;
import jakarta.validation.constraints.NotBlank;

/**
 * 点赞事件；liked=false 表示取消点赞。
 */
public record PostLiked(
        @NotBlank(message = "userId 不能为空") String userId,
        @NotBlank(message = "postId 不能为空") String postId,
        boolean liked) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.POST_LIKED;
    }
}
