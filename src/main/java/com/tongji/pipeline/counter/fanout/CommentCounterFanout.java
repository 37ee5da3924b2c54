package com.tongji.pipeline.counter.fanout;

import com.tongji.pipeline.counter.CounterUpdateCommand;
import com.tongji.pipeline.counter.RelationshipChange;

import java.util.List;

/**
 * 评论关系（{@code POST#p} / {@code COMMENT#c}）：帖子的 commentsCount。
 */
public class CommentCounterFanout implements CounterFanout {
    public static final String POST = "POST";
    public static final String RELATION = "COMMENT";
    public static final String COMMENTS_COUNT = "commentsCount";

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
        return List.of(new CounterUpdateCommand(change.subject().toString(), COMMENTS_COUNT, change.delta()));
    }
}
