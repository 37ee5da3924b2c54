package com.tongji.pipeline.counter;

/**
 * 变更流记录类型。关系行不会原地更新，MODIFY 出现时按空操作处理。
 */
public enum ChangeType {
    INSERT,
    REMOVE,
    MODIFY;

    /**
     * 计数增量：INSERT 为 +1，REMOVE 为 -1，其余为 0。
     */
    public int delta() {
        return switch (this) {
            case INSERT -> 1;
            case REMOVE -> -1;
            case MODIFY -> 0;
        };
    }
}
