package com.tongji.pipeline.relation.service;

import com.tongji.pipeline.cache.CacheStore;
import com.tongji.pipeline.cache.FeedCacheKeys;
import com.tongji.pipeline.common.exception.BusinessException;
import com.tongji.pipeline.common.exception.ErrorCode;
import com.tongji.pipeline.common.exception.InvalidCursorException;
import com.tongji.pipeline.config.PipelineProperties;
import com.tongji.pipeline.pagination.Connection;
import com.tongji.pipeline.pagination.ConnectionBuilder;
import com.tongji.pipeline.pagination.CursorCodec;
import com.tongji.pipeline.pagination.CursorPosition;
import com.tongji.pipeline.relation.api.dto.FollowerPreviewNode;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 粉丝预览查询。
 * 读取消费者维护的 {@code uf:fans:{userId}} 有序集合，按关注时间倒序游标分页。
 * 预览只保留最新若干条，超出部分不在此处回源。
 * 游标同时携带分数与成员ID，同一毫秒关注的多个粉丝跨页时不会被跳过。
 */
@Service
public class FollowerPreviewService {
    private final CacheStore cache;
    private final CursorCodec cursorCodec;
    private final ConnectionBuilder connectionBuilder;
    private final int maxPageSize;

    public FollowerPreviewService(CacheStore cache,
                                  CursorCodec cursorCodec,
                                  ConnectionBuilder connectionBuilder,
                                  PipelineProperties properties) {
        this.cache = cache;
        this.cursorCodec = cursorCodec;
        this.connectionBuilder = connectionBuilder;
        this.maxPageSize = properties.getCache().getPreviewSize();
    }

    /**
     * 游标分页读取粉丝预览。
     * @param userId 被关注的用户ID
     * @param first  页大小（1..预览长度）
     * @param after  上一页的 endCursor，为空代表第一页
     * @return 连接结果
     * @throws InvalidCursorException 游标非法
     */
    public Connection<FollowerPreviewNode> followers(String userId, int first, String after) {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "userId 不能为空");
        }
        if (first < 1 || first > maxPageSize) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "first 取值范围为 1.." + maxPageSize);
        }
        Optional<CursorPosition> position = cursorCodec.decode(after);
        List<CacheStore.ScoredMember> fetched = position.isPresent()
                ? fetchAfter(FeedCacheKeys.followers(userId), position.get(), first + 1)
                : cache.reverseRangeByScore(FeedCacheKeys.followers(userId), null, 0, first + 1);
        List<FollowerPreviewNode> nodes = new ArrayList<>(fetched.size());
        for (CacheStore.ScoredMember m : fetched) {
            nodes.add(new FollowerPreviewNode(m.member(), Instant.ofEpochMilli((long) m.score())));
        }
        return connectionBuilder.page(nodes, first,
                n -> new CursorPosition(n.userId(), Long.toString(n.followedAt().toEpochMilli())),
                position.isPresent());
    }

    /**
     * 读取排在游标之后的至多 want 个成员。
     * 顺序为（分数倒序，成员倒序）；与游标同分的成员中，成员不小于游标 ID 的已在前页返回。
     */
    private List<CacheStore.ScoredMember> fetchAfter(String key, CursorPosition cursor, int want) {
        double cursorScore = parseScore(cursor.sortKey());
        List<CacheStore.ScoredMember> out = new ArrayList<>(want);
        int offset = 0;
        while (out.size() < want) {
            List<CacheStore.ScoredMember> chunk = cache.reverseRangeByScore(key, cursorScore, offset, want);
            for (CacheStore.ScoredMember m : chunk) {
                if (isAfter(m, cursorScore, cursor.id()) && out.size() < want) {
                    out.add(m);
                }
            }
            if (chunk.size() < want) {
                break;
            }
            offset += chunk.size();
        }
        return out;
    }

    private static boolean isAfter(CacheStore.ScoredMember m, double cursorScore, String cursorId) {
        if (m.score() != cursorScore) {
            return m.score() < cursorScore;
        }
        return m.member().compareTo(cursorId) < 0;
    }

    private double parseScore(String sortKey) {
        try {
            return Long.parseLong(sortKey);
        } catch (NumberFormatException e) {
            throw new InvalidCursorException("sortKey is not a timestamp", e);
        }
    }
}
