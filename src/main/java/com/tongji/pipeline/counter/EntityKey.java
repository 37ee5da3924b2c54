package com.tongji.pipeline.counter;

import java.util.Optional;

/**
 * 形如 {@code TYPE#id} 的实体键。
 *
 * @param type 实体类型（如 USER、POST）或关系类型（如 FOLLOW、LIKE）
 * @param id   实体ID
 */
public record EntityKey(String type, String id) {
    public static final char DELIMITER = '#';

    /**
     * 解析实体键；缺少分隔符、类型为空或 ID 为空时返回空。
     */
    public static Optional<EntityKey> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int idx = raw.indexOf(DELIMITER);
        if (idx <= 0 || idx == raw.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new EntityKey(raw.substring(0, idx), raw.substring(idx + 1)));
    }

    public static EntityKey of(String type, String id) {
        return new EntityKey(type, id);
    }

    @Override
    public String toString() {
        return type + DELIMITER + id;
    }
}
