package com.tongji.pipeline.pagination;

/**
 * 游标内部的排序位置。
 *
 * @param id      条目ID（同分数时的标识）
 * @param sortKey 排序键的字符串形式
 */
public record CursorPosition(String id, String sortKey) {
}
