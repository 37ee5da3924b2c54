package com.tongji.pipeline.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 缓存中的帖子快照。likesCount 与 commentsCount 为发帖时的初值，实时点赞数见 {@code post:stats:{postId}}。
 */
public record CachedPost(
        String id,
        String authorId,
        String authorHandle,
        String caption,
        String imageUrl,
        @JsonProperty("isPublic") boolean publicPost,
        long likesCount,
        long commentsCount,
        Instant createdAt
) {
}
