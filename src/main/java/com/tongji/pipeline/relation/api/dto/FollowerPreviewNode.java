package com.tongji.pipeline.relation.api.dto;

import java.time.Instant;

/**
 * 粉丝预览条目。
 *
 * @param userId     粉丝用户ID
 * @param followedAt 关注时间
 */
public record FollowerPreviewNode(String userId, Instant followedAt) {
}
