package com.tongji.pipeline.log;

import java.util.List;

/**
 * 批量写入结果。
 *
 * @param failedCount     失败条数
 * @param perRecordErrors 与入参下标对齐的错误描述，成功为 null
 */
public record WriteBatchResult(int failedCount, List<String> perRecordErrors) {

    public boolean failed(int index) {
        return perRecordErrors.get(index) != null;
    }
}
