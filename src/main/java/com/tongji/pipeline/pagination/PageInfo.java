package com.tongji.pipeline.pagination;

/**
 * 分页信息。空页时两个布尔值为 false，游标为 null。
 */
public record PageInfo(boolean hasNextPage, boolean hasPreviousPage, String startCursor, String endCursor) {

    public static PageInfo empty() {
        return new PageInfo(false, false, null, null);
    }
}
