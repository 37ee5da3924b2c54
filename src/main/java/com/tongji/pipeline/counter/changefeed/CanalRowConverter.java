package com.tongji.pipeline.counter.changefeed;

import com.alibaba.otter.canal.protocol.CanalEntry;
import com.tongji.pipeline.counter.ChangeFeedRecord;
import com.tongji.pipeline.counter.ChangeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canal 行变更到变更流记录的转换。
 * relationship 表的 pk / sk 列即实体键；INSERT 取变更后列，DELETE 取变更前列，UPDATE 记为 MODIFY。
 */
public final class CanalRowConverter {
    public static final String PK_COLUMN = "pk";
    public static final String SK_COLUMN = "sk";

    private CanalRowConverter() {}

    /**
     * 转换一个 RowChange；非关心的事件类型（DDL 等）返回空列表。
     */
    public static List<ChangeFeedRecord> toRecords(CanalEntry.RowChange rowChange) {
        ChangeType type = changeType(rowChange.getEventType());
        if (type == null) {
            return Collections.emptyList();
        }
        List<ChangeFeedRecord> out = new ArrayList<>(rowChange.getRowDatasCount());
        for (CanalEntry.RowData row : rowChange.getRowDatasList()) {
            Map<String, String> before = columns(row.getBeforeColumnsList());
            Map<String, String> after = columns(row.getAfterColumnsList());
            Map<String, String> keySource = type == ChangeType.REMOVE ? before : after;
            out.add(new ChangeFeedRecord(type, keySource.get(PK_COLUMN), keySource.get(SK_COLUMN),
                    type == ChangeType.REMOVE ? null : after,
                    type == ChangeType.INSERT ? null : before));
        }
        return out;
    }

    static ChangeType changeType(CanalEntry.EventType eventType) {
        if (eventType == CanalEntry.EventType.INSERT) {
            return ChangeType.INSERT;
        }
        if (eventType == CanalEntry.EventType.DELETE) {
            return ChangeType.REMOVE;
        }
        if (eventType == CanalEntry.EventType.UPDATE) {
            return ChangeType.MODIFY;
        }
        return null;
    }

    private static Map<String, String> columns(List<CanalEntry.Column> cols) {
        Map<String, String> m = new LinkedHashMap<>();
        for (CanalEntry.Column c : cols) {
            m.put(c.getName().toLowerCase(), c.getIsNull() ? null : c.getValue());
        }
        return m;
    }
}
