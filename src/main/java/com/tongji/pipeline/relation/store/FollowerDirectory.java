package com.tongji.pipeline.relation.store;

import java.util.List;

/**
 * 粉丝关系查询契约，数据来自实体存储中的关注关系行，而非预览缓存。
 */
public interface FollowerDirectory {

    /**
     * @param userId 被关注的用户ID
     * @return 粉丝数
     */
    long followerCount(String userId);

    /**
     * @param userId 被关注的用户ID
     * @return 全部粉丝ID
     */
    List<String> followerIds(String userId);
}
