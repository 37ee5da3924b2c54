package com.tongji.pipeline.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 读优化缓存契约。所有写操作都是按键覆盖或集合幂等操作，可安全重放。
 * 缓存尽力可用：不可用时只影响读新鲜度，不影响实体存储的正确性。
 */
public interface CacheStore {

    /** 按键覆盖写入，附带 TTL。 */
    void upsert(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    /** 有序集合写入（同成员重复写入只更新分数），并只保留分数最高的 keep 个成员。 */
    void addToSortedSet(String key, String member, double score, int keep, Duration ttl);

    void removeFromSortedSet(String key, String member);

    /**
     * 按分数倒序读取：分数不大于 maxInclusive（为空表示不设上界），跳过前 offset 个后至多 limit 个。
     * 同分成员按成员字典序倒序排列，与 Redis ZREVRANGEBYSCORE 一致。
     */
    List<ScoredMember> reverseRangeByScore(String key, Double maxInclusive, int offset, int limit);

    /**
     * 对 Hash 字段做原子加法并刷新 TTL；结果为负时归零。
     * @return 加法后的字段值（不小于 0）
     */
    long incrementField(String key, String field, long delta, Duration ttl);

    /** 标记键存在；不存在时写入并返回 true。 */
    boolean markIfAbsent(String key, Duration ttl);

    boolean exists(String key);

    /**
     * 有序集合成员及其分数。
     */
    record ScoredMember(String member, double score) {
    }
}
