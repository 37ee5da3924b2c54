package com.tongji.pipeline.counter.store;

/**
 * 实体存储的原子更新契约。
 */
public interface EntityStore {

    /**
     * 对聚合记录的计数字段执行原子加法（不做读后写，也不截断为非负）。
     * @param aggregateKey 聚合记录键
     * @param field        计数字段
     * @param delta        增量，可为负
     * @throws RuntimeException 存储不可达或超时
     */
    void atomicAdd(String aggregateKey, String field, long delta);
}
