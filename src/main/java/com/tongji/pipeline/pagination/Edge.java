package com.tongji.pipeline.pagination;

/**
 * 连接中的一条边：条目及其游标。
 */
public record Edge<T>(T node, String cursor) {
}
