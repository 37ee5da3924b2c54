package com.tongji.pipeline.event.publisher;

import com.tongji.pipeline.common.batch.BatchResult;
import com.tongji.pipeline.common.exception.EventPublishException;
import com.tongji.pipeline.config.PipelineProperties;
import com.tongji.pipeline.event.DomainEvent;
import com.tongji.pipeline.event.EventCodec;
import com.tongji.pipeline.event.EventValidator;
import com.tongji.pipeline.log.EventLogException;
import com.tongji.pipeline.log.EventLogWriter;
import com.tongji.pipeline.log.LogEntry;
import com.tongji.pipeline.log.WriteBatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 领域事件发布者。
 * 职责：写路径成功后校验并序列化事件，以 eventId 为分区键追加到事件日志。
 * 批量发布按传输上限分块顺序提交，返回部分失败结果，由调用方决定是否重试失败子集。
 */
@Slf4j
@Service
public class FeedEventPublisher {
    private static final int FAILED_IDS_LOGGED = 10;

    private final EventValidator validator;
    private final EventCodec codec;
    private final EventLogWriter writer;
    private final PipelineProperties.Publisher props;

    public FeedEventPublisher(EventValidator validator, EventCodec codec, EventLogWriter writer,
                              PipelineProperties properties) {
        this.validator = validator;
        this.codec = codec;
        this.writer = writer;
        this.props = properties.getPublisher();
    }

    /**
     * 发布单条事件。
     * @param event 领域事件
     * @throws com.tongji.pipeline.common.exception.EventValidationException 事件不合法，未发生任何 I/O
     * @throws EventPublishException 事件日志写入失败
     */
    public void publish(DomainEvent event) {
        validator.requireValid(event);
        long start = System.currentTimeMillis();
        byte[] data = codec.encode(event);
        try {
            writer.write(event.eventId(), data);
        } catch (EventLogException e) {
            log.error("event.publish failed eventId={} type={} err={}", event.eventId(), event.eventType(), e.getMessage());
            throw new EventPublishException(event.eventId(), e);
        }
        log.info("event.publish eventId={} type={} durationMs={}", event.eventId(), event.eventType(),
                System.currentTimeMillis() - start);
    }

    /**
     * 批量发布事件，按 maxBatchSize 分块顺序提交。
     * 任一事件不合法时整批拒绝且不发生 I/O；某一分块整体提交失败时该分块全部计为失败，后续分块照常提交。
     * @param events 事件列表
     * @return 成功数、失败数与失败事件
     */
    public BatchResult<DomainEvent> publishBatch(List<DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            return BatchResult.empty();
        }
        for (DomainEvent e : events) {
            validator.requireValid(e);
        }
        long start = System.currentTimeMillis();
        List<List<DomainEvent>> chunks = chunk(events, props.getMaxBatchSize());
        BatchResult.Accumulator<DomainEvent> acc = new BatchResult.Accumulator<>();
        for (List<DomainEvent> c : chunks) {
            acc.merge(submitChunk(c));
        }
        BatchResult<DomainEvent> result = acc.build();

        log.info("event.publishBatch total={} chunks={} success={} failed={} durationMs={}",
                events.size(), chunks.size(), result.successCount(), result.failedCount(),
                System.currentTimeMillis() - start);
        if (result.hasFailures()) {
            String ids = result.failedItems().stream()
                    .limit(FAILED_IDS_LOGGED)
                    .map(DomainEvent::eventId)
                    .collect(Collectors.joining(","));
            log.warn("event.publishBatch partial failure failed={} firstFailedIds=[{}]", result.failedCount(), ids);
        }
        return result;
    }

    private BatchResult<DomainEvent> submitChunk(List<DomainEvent> chunk) {
        List<LogEntry> entries = new ArrayList<>(chunk.size());
        for (DomainEvent e : chunk) {
            entries.add(new LogEntry(e.eventId(), codec.encode(e)));
        }
        WriteBatchResult written;
        try {
            written = writer.writeBatch(entries);
        } catch (EventLogException e) {
            log.error("event.publishBatch chunk failed size={} err={}", chunk.size(), e.getMessage());
            return BatchResult.allFailed(chunk);
        }
        BatchResult.Accumulator<DomainEvent> acc = new BatchResult.Accumulator<>();
        for (int i = 0; i < chunk.size(); i++) {
            if (written.failed(i)) {
                acc.failed(chunk.get(i));
            } else {
                acc.succeeded(1);
            }
        }
        return acc.build();
    }

    /**
     * 按固定大小切分，保持原有顺序；最后一块可能不足 size。
     */
    static <T> List<List<T>> chunk(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("chunk size must be positive: " + size);
        }
        List<List<T>> out = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            out.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return out;
    }
}
