package com.tongji.pipeline.cache;

/**
 * Feed 缓存 Key 生成工具。
 */
public final class FeedCacheKeys {
    private FeedCacheKeys() {}

    public static String post(String postId) {
        return "post:" + postId; // 帖子快照（JSON）
    }

    public static String postStats(String postId) {
        return "post:stats:" + postId; // 帖子实时计数（Hash，HINCRBY 原子更新）
    }

    public static String authorPosts(String authorId) {
        return "feed:author:" + authorId; // 作者近期帖子索引（ZSet，分数为发布时间）
    }

    public static String unreadFeed(String userId) {
        return "feed:unread:" + userId; // 未读 Feed（ZSet，分数为发布时间）
    }

    public static String followers(String userId) {
        return "uf:fans:" + userId; // 粉丝预览（ZSet，分数为关注时间）
    }

    public static String followings(String userId) {
        return "uf:flws:" + userId; // 关注预览（ZSet）
    }

    public static String dedup(String eventId) {
        return "dedup:feed:" + eventId; // 已应用事件标记
    }
}
