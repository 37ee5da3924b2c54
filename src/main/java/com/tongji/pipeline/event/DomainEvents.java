package com.tongji.pipeline.event;

import com.tongji.pipeline.event.payload.EventPayload;
import com.tongji.pipeline.event.payload.PostCreated;
import com.tongji.pipeline.event.payload.PostDeleted;
import com.tongji.pipeline.event.payload.PostLiked;
import com.tongji.pipeline.event.payload.PostRead;
import com.tongji.pipeline.event.payload.UserFollowed;
import com.tongji.pipeline.event.payload.UserUnfollowed;

import java.time.Instant;
import java.util.UUID;

/**
 * 领域事件工厂：写路径在一次调用中获得带随机 UUID 与发生时间的事件。
 * 重试时应保留返回的事件对象本身，而不是再次调用工厂。
 */
public final class DomainEvents {
    private DomainEvents() {}

    public static DomainEvent of(EventPayload payload) {
        return new DomainEvent(UUID.randomUUID().toString(), payload.eventType(), Instant.now(), payload);
    }

    public static DomainEvent postCreated(String postId, String authorId, String authorHandle,
                                          String caption, String imageUrl, boolean isPublic, Instant createdAt) {
        return of(new PostCreated(postId, authorId, authorHandle, caption, imageUrl, isPublic, createdAt));
    }

    public static DomainEvent postRead(String userId, String postId) {
        return of(new PostRead(userId, postId));
    }

    public static DomainEvent postLiked(String userId, String postId, boolean liked) {
        return of(new PostLiked(userId, postId, liked));
    }

    public static DomainEvent postDeleted(String postId, String authorId) {
        return of(new PostDeleted(postId, authorId));
    }

    public static DomainEvent userFollowed(String subjectId, String objectId) {
        return of(new UserFollowed(subjectId, objectId));
    }

    public static DomainEvent userUnfollowed(String subjectId, String objectId) {
        return of(new UserUnfollowed(subjectId, objectId));
    }
}
