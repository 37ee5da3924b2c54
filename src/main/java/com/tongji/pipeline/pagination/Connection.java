package com.tongji.pipeline.pagination;

import java.util.List;

/**
 * 游标分页结果。
 */
public record Connection<T>(List<Edge<T>> edges, PageInfo pageInfo) {

    public Connection {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static <T> Connection<T> empty() {
        return new Connection<>(List.of(), PageInfo.empty());
    }
}
