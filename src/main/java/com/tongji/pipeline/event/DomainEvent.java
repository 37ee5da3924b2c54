package com.tongji.pipeline.event;

import com.tongji.pipeline.event.payload.EventPayload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * 领域事件信封。
 *
 * <p>事件在写操作成功时创建，之后不可变；可能被消费零次或多次（至少一次）。
 * {@code eventId} 全局唯一且稳定：同一逻辑事件的重试必须复用原 ID，它同时是分区键。</p>
 *
 * @param eventId    事件ID（分区键与去重键）
 * @param eventType  事件类型，必须与负载结构一致
 * @param occurredAt 发生时间
 * @param payload    事件负载（按类型区分的结构）
 */
public record DomainEvent(
        @NotBlank(message = "eventId 不能为空") String eventId,
        @NotNull(message = "eventType 不能为空") EventType eventType,
        @NotNull(message = "occurredAt 不能为空") Instant occurredAt,
        @NotNull(message = "payload 不能为空") @Valid EventPayload payload) {
}
