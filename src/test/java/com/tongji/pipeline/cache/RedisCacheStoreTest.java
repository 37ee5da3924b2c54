package com.tongji.pipeline.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisCacheStore Unit Tests")
class RedisCacheStoreTest {

    @Mock
    private StringRedisTemplate redis;
    @Mock
    private ZSetOperations<String, String> zset;
    @Mock
    private ValueOperations<String, String> values;

    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCacheStore(redis);
    }

    @Test
    @DisplayName("should add, trim to the newest members and refresh TTL")
    void shouldAddAndTrim() {
        when(redis.opsForZSet()).thenReturn(zset);

        store.addToSortedSet("uf:fans:u2", "u1", 1000d, 50, Duration.ofHours(2));

        verify(zset).add("uf:fans:u2", "u1", 1000d);
        verify(zset).removeRange("uf:fans:u2", 0, -51L);
        verify(redis).expire("uf:fans:u2", Duration.ofHours(2));
    }

    @Test
    @DisplayName("should read up to and including the cursor score from the given offset")
    void shouldReadFromCursorScoreInclusive() {
        when(redis.opsForZSet()).thenReturn(zset);
        Set<ZSetOperations.TypedTuple<String>> tuples = new LinkedHashSet<>();
        tuples.add(new DefaultTypedTuple<>("f4", 4000d));
        tuples.add(new DefaultTypedTuple<>("f3", 3000d));
        when(zset.reverseRangeByScoreWithScores("k", Double.NEGATIVE_INFINITY, 4000d, 2, 3))
                .thenReturn(tuples);

        List<CacheStore.ScoredMember> out = store.reverseRangeByScore("k", 4000d, 2, 3);

        assertThat(out).containsExactly(
                new CacheStore.ScoredMember("f4", 4000d),
                new CacheStore.ScoredMember("f3", 3000d));
    }

    @Test
    @DisplayName("should read by rank when there is no upper bound")
    void shouldReadByRankWithoutBound() {
        when(redis.opsForZSet()).thenReturn(zset);
        Set<ZSetOperations.TypedTuple<String>> tuples = new LinkedHashSet<>();
        tuples.add(new DefaultTypedTuple<>("f5", 5000d));
        when(zset.reverseRangeWithScores("k", 0, 2L)).thenReturn(tuples);

        assertThat(store.reverseRangeByScore("k", null, 0, 3))
                .containsExactly(new CacheStore.ScoredMember("f5", 5000d));
    }

    @Test
    @DisplayName("should increment a hash field in one script call with the TTL in millis")
    @SuppressWarnings("unchecked")
    void shouldIncrementFieldAtomically() {
        when(redis.execute(any(RedisScript.class), eq(List.of("post:stats:p1")), eq("likesCount"), eq("-1"), eq("3600000")))
                .thenReturn(0L);

        long likes = store.incrementField("post:stats:p1", "likesCount", -1L, Duration.ofHours(1));

        assertThat(likes).isZero();
    }

    @Test
    @DisplayName("should report a fresh marker only once")
    void shouldMarkIfAbsent() {
        when(redis.opsForValue()).thenReturn(values);
        when(values.setIfAbsent("dedup:feed:e1", "1", Duration.ofMinutes(10))).thenReturn(true, false);

        assertThat(store.markIfAbsent("dedup:feed:e1", Duration.ofMinutes(10))).isTrue();
        assertThat(store.markIfAbsent("dedup:feed:e1", Duration.ofMinutes(10))).isFalse();
    }
}
