package com.tongji.pipeline.event.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tongji.pipeline.event.EventType;

/**
 * 事件负载：以事件类型为标签的联合类型，每个变体一个结构。
 */
public sealed interface EventPayload
        permits PostCreated, PostRead, PostLiked, PostDeleted, UserFollowed, UserUnfollowed {

    /**
     * 负载对应的事件类型（信封中的 eventType 必须与之一致）。
     */
    @JsonIgnore
    EventType eventType();
}
