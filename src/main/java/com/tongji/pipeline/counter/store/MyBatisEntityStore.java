package com.tongji.pipeline.counter.store;

import org.springframework.stereotype.Component;

/**
 * 基于 MySQL 的实体存储：单条 upsert 语句完成原子加法。
 */
@Component
public class MyBatisEntityStore implements EntityStore {
    private final CounterMapper counterMapper;

    public MyBatisEntityStore(CounterMapper counterMapper) {
        this.counterMapper = counterMapper;
    }

    @Override
    public void atomicAdd(String aggregateKey, String field, long delta) {
        counterMapper.add(aggregateKey, field, delta);
    }
}
