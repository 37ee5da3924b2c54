package com.tongji.pipeline.config;

import com.tongji.pipeline.counter.CounterMaintainer;
import com.tongji.pipeline.counter.fanout.CommentCounterFanout;
import com.tongji.pipeline.counter.fanout.FollowCounterFanout;
import com.tongji.pipeline.counter.fanout.LikeCounterFanout;
import com.tongji.pipeline.counter.store.EntityStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 计数模块配置：每种关系类型一个维护器，共用同一实体存储。
 */
@Configuration
public class CounterConfig {

    @Bean
    public CounterMaintainer followCounterMaintainer(EntityStore store, PipelineProperties properties) {
        return new CounterMaintainer(new FollowCounterFanout(), store, properties.getCounter().getMaxAttempts());
    }

    @Bean
    public CounterMaintainer likeCounterMaintainer(EntityStore store, PipelineProperties properties) {
        return new CounterMaintainer(new LikeCounterFanout(), store, properties.getCounter().getMaxAttempts());
    }

    @Bean
    public CounterMaintainer commentCounterMaintainer(EntityStore store, PipelineProperties properties) {
        return new CounterMaintainer(new CommentCounterFanout(), store, properties.getCounter().getMaxAttempts());
    }
}
