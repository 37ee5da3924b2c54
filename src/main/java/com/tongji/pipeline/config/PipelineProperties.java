package com.tongji.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 一致性管道配置属性，绑定前缀 {@code pipeline.*}。
 *
 * <p>包含以下分组：</p>
 * - Publisher：事件批量发布；
 * - Consumer：事件流消费、重试预算与去重；
 * - Cache：Feed 缓存 TTL 与预览长度；
 * - Feed：未读 Feed 扇出与大 V 阈值；
 * - Counter：计数维护重试预算。
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** 发布配置项。 */
    private final Publisher publisher = new Publisher();
    /** 消费配置项。 */
    private final Consumer consumer = new Consumer();
    /** 缓存配置项。 */
    private final Cache cache = new Cache();
    /** Feed 扇出配置项。 */
    private final Feed feed = new Feed();
    /** 计数配置项。 */
    private final Counter counter = new Counter();

    @Data
    public static class Publisher {
        /** 单次批量提交上限（受传输层限制）。 */
        private int maxBatchSize = 500;
        /** 等待 Broker 确认的超时。 */
        private Duration sendTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Consumer {
        /** 是否启动批量监听容器。 */
        private boolean enabled = true;
        /** 消费组。 */
        private String groupId = "feed-cache-consumer";
        /** 单批最大记录数。 */
        private int maxRecords = 100;
        /** 单批最长等待时间（Broker 凑批等待与容器拉取超时）。 */
        private Duration maxWait = Duration.ofSeconds(10);
        /** Broker 返回前至少累积的字节数，不足时等待至 maxWait。 */
        private int fetchMinBytes = 64 * 1024;
        /** 单条记录的尝试次数上限，超出后转入死信。 */
        private int maxAttempts = 2;
        /** 批级失败（如死信不可达）后整批重投的退避间隔。 */
        private Duration failureBackoff = Duration.ofSeconds(1);
        /** 事件去重标记有效期。 */
        private Duration dedupTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Cache {
        /** 帖子快照 TTL。 */
        private Duration postTtl = Duration.ofHours(1);
        /** 关注/粉丝预览 TTL。 */
        private Duration previewTtl = Duration.ofHours(2);
        /** 预览列表保留的最新条数。 */
        private int previewSize = 50;
    }

    @Data
    public static class Feed {
        /** 粉丝数达到该值的作者发帖不做写扩散，由读路径按需查询。 */
        private long celebrityThreshold = 5000;
        /** 每个用户未读 Feed 保留的最新条数。 */
        private int unreadSize = 500;
        /** 未读 Feed 与作者近期帖子索引的 TTL。 */
        private Duration unreadTtl = Duration.ofDays(7);
    }

    @Data
    public static class Counter {
        /** 单条计数更新的尝试次数上限。 */
        private int maxAttempts = 2;
    }
}
