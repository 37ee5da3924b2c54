package com.tongji.pipeline.counter;

/**
 * 解析后的关系变更：主体 {@code subject} 通过 {@code relationType} 指向 {@code objectId}。
 *
 * @param subject      主体实体键（来自 pk）
 * @param relationType 关系类型（来自 sk 前缀）
 * @param objectId     客体ID（来自 sk）
 * @param delta        +1 / -1
 */
public record RelationshipChange(EntityKey subject, String relationType, String objectId, int delta) {
}
