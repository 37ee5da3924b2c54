package com.tongji.pipeline.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tongji.pipeline.common.exception.InvalidCursorException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * 分页游标编解码：紧凑 JSON {@code {"id","sortKey"}} 经 URL 安全 Base64（无填充）编码为不透明字符串。
 * 解码只信任这两个字符串字段，不反序列化客户端提供的任意结构。
 */
@Component
public class CursorCodec {
    private static final String ID = "id";
    private static final String SORT_KEY = "sortKey";

    private final ObjectMapper mapper;

    public CursorCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper;
    }

    /**
     * 编码游标。id 与 sortKey 必须存在，否则生成的游标无法被 {@link #decode} 接受。
     * @throws IllegalArgumentException 位置或其字段为 null
     */
    public String encode(CursorPosition position) {
        if (position == null || position.id() == null || position.sortKey() == null) {
            throw new IllegalArgumentException("Cursor position requires id and sortKey");
        }
        ObjectNode node = mapper.createObjectNode();
        node.put(ID, position.id());
        node.put(SORT_KEY, position.sortKey());
        try {
            byte[] json = mapper.writeValueAsBytes(node);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cursor is not serializable", e);
        }
    }

    /**
     * 解码游标。
     * @param cursor 客户端传入的游标，null 或空白表示从头开始
     * @return 排序位置；未提供游标时为空
     * @throws InvalidCursorException 游标不是合法编码
     */
    public Optional<CursorPosition> decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return Optional.empty();
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(cursor.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("not base64url", e);
        }
        JsonNode node;
        try {
            node = mapper.readTree(new String(raw, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new InvalidCursorException("not json", e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidCursorException("not an object");
        }
        JsonNode id = node.get(ID);
        JsonNode sortKey = node.get(SORT_KEY);
        if (id == null || !id.isTextual() || sortKey == null || !sortKey.isTextual()) {
            throw new InvalidCursorException("missing id or sortKey");
        }
        return Optional.of(new CursorPosition(id.asText(), sortKey.asText()));
    }
}
