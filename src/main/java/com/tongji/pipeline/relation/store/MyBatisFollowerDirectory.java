package com.tongji.pipeline.relation.store;

import com.tongji.pipeline.counter.EntityKey;
import com.tongji.pipeline.counter.fanout.FollowCounterFanout;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 MySQL 关系表的粉丝查询：关注行为 {@code USER#粉丝 / FOLLOW#被关注者}。
 */
@Component
public class MyBatisFollowerDirectory implements FollowerDirectory {
    private final RelationshipMapper relationshipMapper;

    public MyBatisFollowerDirectory(RelationshipMapper relationshipMapper) {
        this.relationshipMapper = relationshipMapper;
    }

    @Override
    public long followerCount(String userId) {
        return relationshipMapper.countBySk(followKey(userId));
    }

    @Override
    public List<String> followerIds(String userId) {
        List<String> pks = relationshipMapper.listPkBySk(followKey(userId));
        List<String> ids = new ArrayList<>(pks.size());
        for (String pk : pks) {
            EntityKey.parse(pk)
                    .filter(k -> FollowCounterFanout.USER.equals(k.type()))
                    .ifPresent(k -> ids.add(k.id()));
        }
        return ids;
    }

    private static String followKey(String userId) {
        return EntityKey.of(FollowCounterFanout.RELATION, userId).toString();
    }
}
