package com.tongji.pipeline.counter.fanout;

import com.tongji.pipeline.counter.CounterUpdateCommand;
import com.tongji.pipeline.counter.EntityKey;
import com.tongji.pipeline.counter.RelationshipChange;

import java.util.List;

/**
 * 关注关系：主体的 followingCount 与客体的 followersCount 各一次更新。
 */
public class FollowCounterFanout implements CounterFanout {
    public static final String RELATION = "FOLLOW";
    public static final String USER = "USER";
    public static final String FOLLOWING_COUNT = "followingCount";
    public static final String FOLLOWERS_COUNT = "followersCount";

    @Override
    public String relationType() {
        return RELATION;
    }

    @Override
    public String subjectType() {
        return USER;
    }

    @Override
    public List<CounterUpdateCommand> commands(RelationshipChange change) {
        return List.of(
                new CounterUpdateCommand(change.subject().toString(), FOLLOWING_COUNT, change.delta()),
                new CounterUpdateCommand(EntityKey.of(USER, change.objectId()).toString(), FOLLOWERS_COUNT, change.delta()));
    }
}
