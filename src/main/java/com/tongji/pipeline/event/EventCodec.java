package com.tongji.pipeline.event;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tongji.pipeline.event.payload.EventPayload;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

/**
 * 领域事件 JSON 编解码。
 *
 * <p>线上格式：{@code {"eventId","eventType","occurredAt","payload":{...}}}，UTF-8，时间为 ISO-8601。
 * 解码时先读取 eventType，再按类型选择负载结构，未知类型与缺失字段均视为格式错误。</p>
 */
@Component
public class EventCodec {
    private final ObjectMapper mapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 序列化事件。
     * @param event 已校验的事件
     * @return UTF-8 JSON 字节
     */
    public byte[] encode(DomainEvent event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (IOException e) {
            throw new IllegalStateException("Event is not serializable: " + event.eventId(), e);
        }
    }

    /**
     * 反序列化事件。
     * @param data 记录字节
     * @return 事件（尚未做 Schema 校验）
     * @throws IOException JSON 非法或结构不符
     */
    public DomainEvent decode(byte[] data) throws IOException {
        JsonNode root = mapper.readTree(data);
        if (root == null || !root.isObject()) {
            throw new IOException("Event root is not an object");
        }
        EventType type = parseType(root.get("eventType"));
        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || !payloadNode.isObject()) {
            throw new IOException("Event payload is missing");
        }
        EventPayload payload = mapper.treeToValue(payloadNode, type.payloadClass());
        JsonNode occurredNode = root.get("occurredAt");
        Instant occurredAt = occurredNode == null || occurredNode.isNull()
                ? null
                : mapper.treeToValue(occurredNode, Instant.class);
        return new DomainEvent(text(root.get("eventId")), type, occurredAt, payload);
    }

    /**
     * 将无法解析的原始字节包装为 {@code {"raw": "..."}}，用于日志与死信。
     */
    public ObjectNode rawEnvelope(String raw) {
        ObjectNode node = mapper.createObjectNode();
        node.put("raw", raw);
        return node;
    }

    private EventType parseType(JsonNode node) throws IOException {
        if (node == null || !node.isTextual()) {
            throw new IOException("Event type is missing");
        }
        try {
            return EventType.valueOf(node.asText());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown event type: " + node.asText(), e);
        }
    }

    private String text(JsonNode n) {
        return n == null || n.isNull() ? null : n.asText();
    }
}
