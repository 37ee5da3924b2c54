package com.tongji.pipeline.relation.api;

import com.tongji.pipeline.pagination.Connection;
import com.tongji.pipeline.relation.api.dto.FollowerPreviewNode;
import com.tongji.pipeline.relation.service.FollowerPreviewService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 关系预览接口。
 */
@RestController
@RequestMapping("/api/v1/relation")
public class RelationPreviewController {
    private final FollowerPreviewService followerPreviewService;

    public RelationPreviewController(FollowerPreviewService followerPreviewService) {
        this.followerPreviewService = followerPreviewService;
    }

    /**
     * 粉丝预览（最新关注在前），游标分页。
     * @param userId 用户ID
     * @param first 页大小
     * @param after 上一页 endCursor
     * @return edges + pageInfo
     */
    @GetMapping("/followers/preview")
    public Connection<FollowerPreviewNode> followersPreview(@RequestParam("userId") String userId,
                                                            @RequestParam(value = "first", defaultValue = "20") int first,
                                                            @RequestParam(value = "after", required = false) String after) {
        return followerPreviewService.followers(userId, first, after);
    }
}
