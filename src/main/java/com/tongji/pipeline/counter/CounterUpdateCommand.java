package com.tongji.pipeline.counter;

/**
 * 一次原子计数更新。
 *
 * @param aggregateKey 聚合记录键，如 {@code USER#u1}
 * @param field        计数字段，如 followersCount
 * @param delta        增量
 */
public record CounterUpdateCommand(String aggregateKey, String field, long delta) {
}
