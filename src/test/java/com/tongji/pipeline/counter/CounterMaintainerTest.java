package com.tongji.pipeline.counter;

import com.tongji.pipeline.common.batch.BatchResult;
import com.tongji.pipeline.counter.fanout.CommentCounterFanout;
import com.tongji.pipeline.counter.fanout.FollowCounterFanout;
import com.tongji.pipeline.counter.fanout.LikeCounterFanout;
import com.tongji.pipeline.support.RecordingEntityStore;
import com.tongji.pipeline.support.RecordingEntityStore.Call;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CounterMaintainer Unit Tests")
class CounterMaintainerTest {

    private RecordingEntityStore store;
    private CounterMaintainer follow;

    @BeforeEach
    void setUp() {
        store = new RecordingEntityStore();
        follow = new CounterMaintainer(new FollowCounterFanout(), store, 2);
    }

    @Nested
    @DisplayName("FOLLOW fan-out Tests")
    class FollowTests {

        @Test
        @DisplayName("should increment following and followers counts on INSERT")
        void shouldIncrementOnInsert() {
            BatchResult<ChangeFeedRecord> result = follow.processBatch(List.of(ChangeFeedRecord.insert("USER#u1", "FOLLOW#u2")));

            assertThat(store.calls()).containsExactly(
                    new Call("USER#u1", "followingCount", 1),
                    new Call("USER#u2", "followersCount", 1));
            assertThat(result.successCount()).isEqualTo(1);
            assertThat(result.hasFailures()).isFalse();
        }

        @Test
        @DisplayName("should decrement both counts on REMOVE")
        void shouldDecrementOnRemove() {
            follow.processBatch(List.of(ChangeFeedRecord.remove("USER#u1", "FOLLOW#u2")));

            assertThat(store.calls()).containsExactly(
                    new Call("USER#u1", "followingCount", -1),
                    new Call("USER#u2", "followersCount", -1));
        }

        @Test
        @DisplayName("should ignore MODIFY records")
        void shouldIgnoreModify() {
            ChangeFeedRecord modify = new ChangeFeedRecord(ChangeType.MODIFY, "USER#u1", "FOLLOW#u2", Map.of(), Map.of());

            BatchResult<ChangeFeedRecord> result = follow.processBatch(List.of(modify));

            assertThat(store.calls()).isEmpty();
            assertThat(result.failedCount()).isZero();
        }

        @Test
        @DisplayName("should ignore other relation types")
        void shouldIgnoreOtherRelations() {
            follow.processBatch(List.of(ChangeFeedRecord.insert("POST#p1", "LIKE#u7")));

            assertThat(store.calls()).isEmpty();
        }

        @Test
        @DisplayName("should skip a malformed key and keep processing the batch")
        void shouldSkipMalformedKey() {
            List<ChangeFeedRecord> batch = List.of(
                    ChangeFeedRecord.insert("USER#a", "FOLLOW#b"),
                    ChangeFeedRecord.insert("BADKEY", "FOLLOW#b"),
                    ChangeFeedRecord.insert("USER#c", "FOLLOW#d"));

            BatchResult<ChangeFeedRecord> result = follow.processBatch(batch);

            assertThat(store.calls()).extracting(Call::aggregateKey)
                    .containsExactly("USER#a", "USER#b", "USER#c", "USER#d");
            assertThat(result.failedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Failure isolation Tests")
    class FailureTests {

        @Test
        @DisplayName("should still attempt the second command when the first keeps failing")
        void shouldAttemptIndependentCommands() {
            store.failWhen(c -> c.field().equals("followingCount"));
            ChangeFeedRecord record = ChangeFeedRecord.insert("USER#u1", "FOLLOW#u2");

            BatchResult<ChangeFeedRecord> result = follow.processBatch(List.of(record));

            assertThat(store.calls()).containsExactly(
                    new Call("USER#u1", "followingCount", 1),
                    new Call("USER#u1", "followingCount", 1),
                    new Call("USER#u2", "followersCount", 1));
            assertThat(store.counter("USER#u2", "followersCount")).isEqualTo(1);
            assertThat(result.failedItems()).containsExactly(record);
        }

        @Test
        @DisplayName("should succeed when a retry of the command succeeds")
        void shouldSucceedOnRetry() {
            int[] failures = {1};
            store.failWhen(c -> failures[0]-- > 0);

            BatchResult<ChangeFeedRecord> result = follow.processBatch(List.of(ChangeFeedRecord.insert("USER#u1", "FOLLOW#u2")));

            assertThat(store.calls()).hasSize(3);
            assertThat(result.hasFailures()).isFalse();
            assertThat(store.counter("USER#u1", "followingCount")).isEqualTo(1);
        }

        @Test
        @DisplayName("should continue with later records after a failed record")
        void shouldContinueAfterFailedRecord() {
            store.failWhen(c -> c.aggregateKey().equals("USER#x"));
            List<ChangeFeedRecord> batch = List.of(
                    ChangeFeedRecord.insert("USER#x", "FOLLOW#y"),
                    ChangeFeedRecord.insert("USER#a", "FOLLOW#b"));

            BatchResult<ChangeFeedRecord> result = follow.processBatch(batch);

            assertThat(result.successCount()).isEqualTo(1);
            assertThat(result.failedCount()).isEqualTo(1);
            assertThat(store.counter("USER#a", "followingCount")).isEqualTo(1);
            assertThat(store.counter("USER#b", "followersCount")).isEqualTo(1);
        }

        @Test
        @DisplayName("should let a duplicate REMOVE drive a counter negative")
        void shouldNotClampDuplicateRemove() {
            follow.processBatch(List.of(
                    ChangeFeedRecord.insert("USER#u1", "FOLLOW#u2"),
                    ChangeFeedRecord.remove("USER#u1", "FOLLOW#u2"),
                    ChangeFeedRecord.remove("USER#u1", "FOLLOW#u2")));

            assertThat(store.counter("USER#u2", "followersCount")).isEqualTo(-1);
        }
    }

    @Test
    @DisplayName("should update post counters for LIKE and COMMENT relations")
    void shouldUpdatePostCounters() {
        CounterMaintainer like = new CounterMaintainer(new LikeCounterFanout(), store, 2);
        CounterMaintainer comment = new CounterMaintainer(new CommentCounterFanout(), store, 2);
        List<ChangeFeedRecord> batch = List.of(
                ChangeFeedRecord.insert("POST#p1", "LIKE#u7"),
                ChangeFeedRecord.insert("POST#p1", "COMMENT#c1"),
                ChangeFeedRecord.insert("USER#u1", "FOLLOW#u2"));

        like.processBatch(batch);
        comment.processBatch(batch);

        assertThat(store.calls()).containsExactly(
                new Call("POST#p1", "likesCount", 1),
                new Call("POST#p1", "commentsCount", 1));
    }

    @Test
    @DisplayName("should skip relation rows whose subject has the wrong entity type")
    void shouldSkipWrongSubjectType() {
        CounterMaintainer like = new CounterMaintainer(new LikeCounterFanout(), store, 2);
        List<ChangeFeedRecord> batch = List.of(
                ChangeFeedRecord.insert("POST#p1", "FOLLOW#u2"),
                ChangeFeedRecord.insert("USER#u1", "LIKE#p9"),
                ChangeFeedRecord.insert("USER#u3", "FOLLOW#u4"));

        BatchResult<ChangeFeedRecord> followResult = follow.processBatch(batch);
        BatchResult<ChangeFeedRecord> likeResult = like.processBatch(batch);

        assertThat(store.calls()).containsExactly(
                new Call("USER#u3", "followingCount", 1),
                new Call("USER#u4", "followersCount", 1));
        assertThat(followResult.failedCount()).isZero();
        assertThat(likeResult.failedCount()).isZero();
        assertThat(store.counter("POST#p1", "followingCount")).isZero();
    }

    @Test
    @DisplayName("should require at least one attempt")
    void shouldRequirePositiveAttempts() {
        assertThatThrownBy(() -> new CounterMaintainer(new FollowCounterFanout(), store, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
