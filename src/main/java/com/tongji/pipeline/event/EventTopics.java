package com.tongji.pipeline.event;

/**
 * 事件日志相关 Kafka 主题常量。
 */
public final class EventTopics {
    public static final String FEED_EVENTS = "feed-events"; // 领域事件主题（按 eventId 分区）
    public static final String FEED_EVENTS_DLQ = "feed-events-dlq"; // 超出重试预算的记录
    public static final String RELATIONSHIP_CHANGES_DLQ = "relationship-changes-dlq"; // 计数更新耗尽重试的变更流记录
    private EventTopics() {}
}
