package com.tongji.pipeline.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tongji.pipeline.cache.CacheStore;
import com.tongji.pipeline.cache.CachedPost;
import com.tongji.pipeline.cache.FeedCacheKeys;
import com.tongji.pipeline.config.PipelineProperties;
import com.tongji.pipeline.event.DomainEvent;
import com.tongji.pipeline.event.payload.PostCreated;
import com.tongji.pipeline.event.payload.PostDeleted;
import com.tongji.pipeline.event.payload.PostLiked;
import com.tongji.pipeline.event.payload.PostRead;
import com.tongji.pipeline.event.payload.UserFollowed;
import com.tongji.pipeline.event.payload.UserUnfollowed;
import com.tongji.pipeline.relation.store.FollowerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Feed 缓存副作用处理器。
 * 职责：按事件类型刷新读路径缓存（帖子快照、实时计数、未读 Feed、关注/粉丝预览），并以事件 ID 去重。
 *
 * <p>未读 Feed 采用写扩散与读时查询混合：作者粉丝数低于大 V 阈值时发帖写入每个粉丝的
 * {@code feed:unread:{followerId}}；达到阈值则跳过，由读路径按需查询。取消关注与删帖时回收对应条目。</p>
 *
 * <p>除点赞计数外的写入均为按实体 ID 覆盖或集合幂等操作，跨分区乱序与重放下收敛到相同结果。</p>
 */
@Service
public class FeedCacheUpdater {
    private static final Logger log = LoggerFactory.getLogger(FeedCacheUpdater.class);
    static final String LIKES_COUNT = "likesCount";

    private final CacheStore cache;
    private final FollowerDirectory followers;
    private final ObjectMapper objectMapper;
    private final PipelineProperties.Cache cacheProps;
    private final PipelineProperties.Feed feedProps;
    private final PipelineProperties.Consumer consumerProps;

    public FeedCacheUpdater(CacheStore cache,
                            FollowerDirectory followers,
                            ObjectMapper objectMapper,
                            PipelineProperties properties) {
        this.cache = cache;
        this.followers = followers;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.cacheProps = properties.getCache();
        this.feedProps = properties.getFeed();
        this.consumerProps = properties.getConsumer();
    }

    /**
     * 应用事件对应的缓存副作用。
     * @param event 已校验的事件
     * @return 处理结果描述（用于日志）
     * @throws RuntimeException 缓存不可用等瞬时错误，由调用方计入该条记录的失败
     */
    public String apply(DomainEvent event) {
        String dk = FeedCacheKeys.dedup(event.eventId());
        // 已应用过的事件（重放）直接确认
        if (cache.exists(dk)) {
            return "duplicate";
        }
        String outcome = switch (event.eventType()) {
            case POST_CREATED -> onPostCreated((PostCreated) event.payload());
            case POST_READ -> onPostRead((PostRead) event.payload());
            case POST_LIKED -> onPostLiked((PostLiked) event.payload());
            case POST_DELETED -> onPostDeleted((PostDeleted) event.payload());
            case USER_FOLLOWED -> onUserFollowed((UserFollowed) event.payload(), event);
            case USER_UNFOLLOWED -> onUserUnfollowed((UserUnfollowed) event.payload());
        };
        cache.markIfAbsent(dk, consumerProps.getDedupTtl());
        return outcome;
    }

    private String onPostCreated(PostCreated p) {
        CachedPost post = new CachedPost(p.postId(), p.authorId(), p.authorHandle(), p.caption(), p.imageUrl(),
                p.publicPost(), 0L, 0L, p.createdAt());
        cache.upsert(FeedCacheKeys.post(p.postId()), write(post), cacheProps.getPostTtl());

        double score = p.createdAt().toEpochMilli();
        int keep = feedProps.getUnreadSize();
        // 作者近期帖子索引，取消关注时据此回收
        cache.addToSortedSet(FeedCacheKeys.authorPosts(p.authorId()), p.postId(), score, keep, feedProps.getUnreadTtl());

        long followerCount = followers.followerCount(p.authorId());
        if (followerCount >= feedProps.getCelebrityThreshold()) {
            log.info("feed.fanout celebrity bypass authorId={} postId={} followers={} threshold={}",
                    p.authorId(), p.postId(), followerCount, feedProps.getCelebrityThreshold());
            return "cached-bypass";
        }
        List<String> ids = followers.followerIds(p.authorId());
        for (String followerId : ids) {
            cache.addToSortedSet(FeedCacheKeys.unreadFeed(followerId), p.postId(), score, keep, feedProps.getUnreadTtl());
        }
        log.debug("feed.fanout authorId={} postId={} followers={}", p.authorId(), p.postId(), ids.size());
        return "fanned-out=" + ids.size();
    }

    private String onPostRead(PostRead p) {
        cache.removeFromSortedSet(FeedCacheKeys.unreadFeed(p.userId()), p.postId());
        return "marked-read";
    }

    private String onPostLiked(PostLiked p) {
        // 帖子不在缓存中是正常情况
        if (!cache.exists(FeedCacheKeys.post(p.postId()))) {
            return "miss";
        }
        long likes = cache.incrementField(FeedCacheKeys.postStats(p.postId()), LIKES_COUNT,
                p.liked() ? 1L : -1L, cacheProps.getPostTtl());
        return "likes=" + likes;
    }

    private String onPostDeleted(PostDeleted p) {
        cache.delete(FeedCacheKeys.post(p.postId()));
        cache.delete(FeedCacheKeys.postStats(p.postId()));
        cache.removeFromSortedSet(FeedCacheKeys.authorPosts(p.authorId()), p.postId());
        List<String> ids = followers.followerIds(p.authorId());
        for (String followerId : ids) {
            cache.removeFromSortedSet(FeedCacheKeys.unreadFeed(followerId), p.postId());
        }
        return "invalidated feeds=" + ids.size();
    }

    private String onUserFollowed(UserFollowed p, DomainEvent event) {
        double score = event.occurredAt().toEpochMilli();
        int keep = cacheProps.getPreviewSize();
        cache.addToSortedSet(FeedCacheKeys.followers(p.objectId()), p.subjectId(), score, keep, cacheProps.getPreviewTtl());
        cache.addToSortedSet(FeedCacheKeys.followings(p.subjectId()), p.objectId(), score, keep, cacheProps.getPreviewTtl());
        return "preview-added";
    }

    private String onUserUnfollowed(UserUnfollowed p) {
        cache.removeFromSortedSet(FeedCacheKeys.followers(p.objectId()), p.subjectId());
        cache.removeFromSortedSet(FeedCacheKeys.followings(p.subjectId()), p.objectId());
        // 从取关者的未读 Feed 中移除被取关作者的帖子
        List<CacheStore.ScoredMember> posts =
                cache.reverseRangeByScore(FeedCacheKeys.authorPosts(p.objectId()), null, 0, feedProps.getUnreadSize());
        String feed = FeedCacheKeys.unreadFeed(p.subjectId());
        for (CacheStore.ScoredMember post : posts) {
            cache.removeFromSortedSet(feed, post.member());
        }
        return "preview-removed feedItems=" + posts.size();
    }

    private String write(CachedPost post) {
        try {
            return objectMapper.writeValueAsString(post);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Post snapshot is not serializable: " + post.id(), e);
        }
    }
}
