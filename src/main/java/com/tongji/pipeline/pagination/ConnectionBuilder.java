package com.tongji.pipeline.pagination;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 连接组装器：把已按最终顺序排列的条目包装为带游标的边并计算分页信息。不会重新排序。
 */
@Component
public class ConnectionBuilder {
    private final CursorCodec codec;

    public ConnectionBuilder(CursorCodec codec) {
        this.codec = codec;
    }

    /**
     * 组装连接。
     * @param nodes               本页条目（调用方已排好序）
     * @param hasMore             是否还有下一页
     * @param cursorData          提取条目排序位置的函数
     * @param startCursorSupplied 请求是否携带了起始游标
     */
    public <T> Connection<T> build(List<T> nodes,
                                   boolean hasMore,
                                   Function<T, CursorPosition> cursorData,
                                   boolean startCursorSupplied) {
        if (nodes == null || nodes.isEmpty()) {
            return Connection.empty();
        }
        List<Edge<T>> edges = new ArrayList<>(nodes.size());
        for (T n : nodes) {
            edges.add(new Edge<>(n, codec.encode(cursorData.apply(n))));
        }
        PageInfo info = new PageInfo(hasMore, startCursorSupplied,
                edges.get(0).cursor(), edges.get(edges.size() - 1).cursor());
        return new Connection<>(edges, info);
    }

    /**
     * 处理 limit+1 的超量读取：多出的一条只用来判断 hasMore，不进入结果。
     * @param fetched             至多 limit+1 条
     * @param limit               请求的页大小
     * @param cursorData          提取条目排序位置的函数
     * @param startCursorSupplied 请求是否携带了起始游标
     */
    public <T> Connection<T> page(List<T> fetched,
                                  int limit,
                                  Function<T, CursorPosition> cursorData,
                                  boolean startCursorSupplied) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (fetched == null || fetched.isEmpty()) {
            return Connection.empty();
        }
        boolean hasMore = fetched.size() > limit;
        List<T> nodes = hasMore ? fetched.subList(0, limit) : fetched;
        return build(nodes, hasMore, cursorData, startCursorSupplied);
    }
}
