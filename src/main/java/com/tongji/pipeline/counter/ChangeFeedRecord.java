package com.tongji.pipeline.counter;

import java.util.Map;

/**
 * 实体存储变更流中的一条行级记录。
 *
 * @param changeType 变更类型
 * @param pk         主键，形如 {@code USER#u1}
 * @param sk         排序键，形如 {@code FOLLOW#u2}
 * @param newImage   变更后的行（REMOVE 时为空）
 * @param oldImage   变更前的行（INSERT 时为空）
 */
public record ChangeFeedRecord(ChangeType changeType,
                               String pk,
                               String sk,
                               Map<String, String> newImage,
                               Map<String, String> oldImage) {

    public static ChangeFeedRecord insert(String pk, String sk) {
        return new ChangeFeedRecord(ChangeType.INSERT, pk, sk, Map.of(), null);
    }

    public static ChangeFeedRecord remove(String pk, String sk) {
        return new ChangeFeedRecord(ChangeType.REMOVE, pk, sk, null, Map.of());
    }
}
