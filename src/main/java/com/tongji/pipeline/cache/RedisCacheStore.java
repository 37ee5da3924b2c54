package com.tongji.pipeline.cache;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis 缓存实现：字符串键存快照，Hash 存实时计数，ZSet 按时间分数维护最近项并设置短 TTL 减少陈旧数据。
 */
@Component
public class RedisCacheStore implements CacheStore {
    // HINCRBY 后结果为负则归零，并刷新 TTL；整体在 Redis 内原子执行
    private static final String INCR_FLOOR_LUA = """
            local v = redis.call('HINCRBY', KEYS[1], ARGV[1], ARGV[2])
            if v < 0 then
              redis.call('HSET', KEYS[1], ARGV[1], 0)
              v = 0
            end
            redis.call('PEXPIRE', KEYS[1], ARGV[3])
            return v
            """;

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> incrFloorScript;

    public RedisCacheStore(StringRedisTemplate redis) {
        this.redis = redis;
        this.incrFloorScript = new DefaultRedisScript<>(INCR_FLOOR_LUA, Long.class);
    }

    @Override
    public void upsert(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void delete(String key) {
        redis.delete(key);
    }

    @Override
    public void addToSortedSet(String key, String member, double score, int keep, Duration ttl) {
        redis.opsForZSet().add(key, member, score);
        // 仅保留分数最高的 keep 个成员（按分数升序删除前面的部分）
        redis.opsForZSet().removeRange(key, 0, -keep - 1L);
        redis.expire(key, ttl);
    }

    @Override
    public void removeFromSortedSet(String key, String member) {
        redis.opsForZSet().remove(key, member);
    }

    @Override
    public List<ScoredMember> reverseRangeByScore(String key, Double maxInclusive, int offset, int limit) {
        Set<ZSetOperations.TypedTuple<String>> tuples;
        if (maxInclusive == null) {
            tuples = redis.opsForZSet().reverseRangeWithScores(key, offset, offset + limit - 1L);
        } else {
            // 上界含游标分数本身：同分的剩余成员由调用方按成员过滤
            tuples = redis.opsForZSet().reverseRangeByScoreWithScores(key, Double.NEGATIVE_INFINITY, maxInclusive, offset, limit);
        }
        if (tuples == null || tuples.isEmpty()) {
            return Collections.emptyList();
        }
        List<ScoredMember> out = new ArrayList<>(tuples.size());
        for (ZSetOperations.TypedTuple<String> t : tuples) {
            if (t.getValue() == null || t.getScore() == null) continue;
            out.add(new ScoredMember(t.getValue(), t.getScore()));
        }
        return out;
    }

    @Override
    public long incrementField(String key, String field, long delta, Duration ttl) {
        Long value = redis.execute(incrFloorScript, List.of(key), field, String.valueOf(delta), String.valueOf(ttl.toMillis()));
        return value == null ? 0L : value;
    }

    @Override
    public boolean markIfAbsent(String key, Duration ttl) {
        Boolean first = redis.opsForValue().setIfAbsent(key, "1", ttl);
        return Boolean.TRUE.equals(first);
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }
}
