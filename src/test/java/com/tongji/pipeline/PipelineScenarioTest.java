package com.tongji.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tongji.pipeline.cache.FeedCacheKeys;
import com.tongji.pipeline.common.batch.BatchResult;
import com.tongji.pipeline.consumer.FeedCacheUpdater;
import com.tongji.pipeline.consumer.FeedEventConsumer;
import com.tongji.pipeline.consumer.FeedEventListener;
import com.tongji.pipeline.counter.ChangeFeedRecord;
import com.tongji.pipeline.counter.CounterMaintainer;
import com.tongji.pipeline.counter.fanout.FollowCounterFanout;
import com.tongji.pipeline.event.DomainEvent;
import com.tongji.pipeline.event.DomainEvents;
import com.tongji.pipeline.event.publisher.FeedEventPublisher;
import com.tongji.pipeline.log.DeadLetterSink;
import com.tongji.pipeline.pagination.Connection;
import com.tongji.pipeline.pagination.ConnectionBuilder;
import com.tongji.pipeline.pagination.CursorCodec;
import com.tongji.pipeline.relation.api.dto.FollowerPreviewNode;
import com.tongji.pipeline.relation.service.FollowerPreviewService;
import com.tongji.pipeline.support.InMemoryCacheStore;
import com.tongji.pipeline.support.InMemoryEventLog;
import com.tongji.pipeline.support.InMemoryFollowerDirectory;
import com.tongji.pipeline.support.RecordingEntityStore;
import com.tongji.pipeline.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("Follow pipeline scenario")
class PipelineScenarioTest {

    @Test
    @DisplayName("follow u1 -> u2 refreshes the follower preview and both counters")
    void followScenario() {
        InMemoryEventLog eventLog = new InMemoryEventLog();
        InMemoryCacheStore cache = new InMemoryCacheStore();
        RecordingEntityStore store = new RecordingEntityStore();
        DeadLetterSink dlq = mock(DeadLetterSink.class);
        Acknowledgment ack = mock(Acknowledgment.class);
        var props = TestFixtures.properties();

        FeedEventPublisher publisher = new FeedEventPublisher(TestFixtures.validator(), TestFixtures.codec(), eventLog, props);
        FeedEventListener listener = new FeedEventListener(new FeedEventConsumer(TestFixtures.codec(), TestFixtures.validator(),
                new FeedCacheUpdater(cache, new InMemoryFollowerDirectory(), new ObjectMapper(), props), dlq, props));
        CounterMaintainer maintainer = new CounterMaintainer(new FollowCounterFanout(), store, 2);
        CursorCodec cursorCodec = new CursorCodec(new ObjectMapper());
        FollowerPreviewService previews = new FollowerPreviewService(cache, cursorCodec, new ConnectionBuilder(cursorCodec), props);

        // 写路径：发布事件，同时关系行插入产生变更流记录
        DomainEvent followed = DomainEvents.userFollowed("u1", "u2");
        publisher.publish(followed);
        BatchResult<ChangeFeedRecord> counted = maintainer.processBatch(List.of(ChangeFeedRecord.insert("USER#u1", "FOLLOW#u2")));

        listener.onMessages(eventLog.records(), ack);

        verify(ack).acknowledge();
        assertThat(cache.members(FeedCacheKeys.followers("u2"))).containsExactly("u1");
        assertThat(counted.hasFailures()).isFalse();
        assertThat(store.counter("USER#u1", "followingCount")).isEqualTo(1);
        assertThat(store.counter("USER#u2", "followersCount")).isEqualTo(1);
        verifyNoInteractions(dlq);

        Connection<FollowerPreviewNode> page = previews.followers("u2", 10, null);
        assertThat(page.edges()).singleElement().satisfies(e -> {
            assertThat(e.node().userId()).isEqualTo("u1");
            assertThat(e.node().followedAt()).isEqualTo(followed.occurredAt().truncatedTo(ChronoUnit.MILLIS));
        });
    }

    @Test
    @DisplayName("a post reaches followers' unread feeds and leaves them again on unfollow")
    void feedScenario() {
        InMemoryEventLog eventLog = new InMemoryEventLog();
        InMemoryCacheStore cache = new InMemoryCacheStore();
        InMemoryFollowerDirectory directory = new InMemoryFollowerDirectory().follow("u1", "u2");
        DeadLetterSink dlq = mock(DeadLetterSink.class);
        var props = TestFixtures.properties();

        FeedEventPublisher publisher = new FeedEventPublisher(TestFixtures.validator(), TestFixtures.codec(), eventLog, props);
        FeedEventListener listener = new FeedEventListener(new FeedEventConsumer(TestFixtures.codec(), TestFixtures.validator(),
                new FeedCacheUpdater(cache, directory, new ObjectMapper(), props), dlq, props));

        publisher.publish(DomainEvents.postCreated("p1", "u2", "bob", "hi", null, true, Instant.parse("2024-05-01T10:00:00Z")));
        listener.onMessages(eventLog.records(), mock(Acknowledgment.class));
        assertThat(cache.members(FeedCacheKeys.unreadFeed("u1"))).containsExactly("p1");

        directory.unfollow("u1", "u2");
        InMemoryEventLog next = new InMemoryEventLog();
        new FeedEventPublisher(TestFixtures.validator(), TestFixtures.codec(), next, props)
                .publish(DomainEvents.userUnfollowed("u1", "u2"));
        listener.onMessages(next.records(), mock(Acknowledgment.class));

        assertThat(cache.members(FeedCacheKeys.unreadFeed("u1"))).isEmpty();
        verifyNoInteractions(dlq);
    }
}
