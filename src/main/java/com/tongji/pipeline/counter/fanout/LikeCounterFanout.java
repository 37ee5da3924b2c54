package com.tongji.pipeline.counter.fanout;

import com.tongji.pipeline.counter.CounterUpdateCommand;
import com.tongji.pipeline.counter.RelationshipChange;

import java.util.List;

/**
 * 点赞关系（{@code POST#p} / {@code LIKE#u}）：帖子的 likesCount。
 */
public class LikeCounterFanout implements CounterFanout {
    public static final String POST = "POST";
    public static final String RELATION = "LIKE";
    public static final String LIKES_COUNT = "likesCount";

    @Override
    public String relationType() {
        return RELATION;
    }

    @Override
    public String subjectType() {
        return POST;
    }

    @Override
    public List<CounterUpdateCommand> commands(RelationshipChange change) {
        return List.of(new CounterUpdateCommand(change.subject().toString(), LIKES_COUNT, change.delta()));
    }
}
