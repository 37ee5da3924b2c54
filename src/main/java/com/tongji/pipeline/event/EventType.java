package com.tongji.pipeline.event;

import com.tongji.pipeline.event.payload.EventPayload;
import com.tongji.pipeline.event.payload.PostCreated;
import com.tongji.pipeline.event.payload.PostDeleted;
import com.tongji.pipeline.event.payload.PostLiked;
import com.tongji.pipeline.event.payload.PostRead;
import com.tongji.pipeline.event.payload.UserFollowed;
import com.tongji.pipeline.event.payload.UserUnfollowed;

/**
 * 领域事件类型。每个类型对应唯一的负载结构，解码时据此选择负载类。
 */
public enum EventType {
    POST_CREATED(PostCreated.class),
    POST_READ(PostRead.class),
    POST_LIKED(PostLiked.class),
    POST_DELETED(PostDeleted.class),
    USER_FOLLOWED(UserFollowed.class),
    USER_UNFOLLOWED(UserUnfollowed.class);

    private final Class<? extends EventPayload> payloadClass;

    EventType(Class<? extends EventPayload> payloadClass) {
        this.payloadClass = payloadClass;
    }

    public Class<? extends EventPayload> payloadClass() {
        return payloadClass;
    }
}
