package com.tongji.pipeline.consumer;

import com.tongji.pipeline.common.batch.BatchResult;
import com.tongji.pipeline.config.PipelineProperties;
import com.tongji.pipeline.event.DomainEvent;
import com.tongji.pipeline.event.EventCodec;
import com.tongji.pipeline.event.EventValidator;
import com.tongji.pipeline.log.DeadLetterSink;
import com.tongji.pipeline.log.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 事件流消费者。
 *
 * <p>对监听容器拉取到的一批记录依次执行：</p>
 * - PROCESS_BATCH：逐条解码并刷新缓存，单条失败只记录不抛出，不影响同批其他记录；
 * - REPORT：返回失败子集；可重试的失败在重试预算内重投，超出预算或格式错误的记录转入死信。
 *
 * <p>分区内按到达顺序处理；整批处理完成后才由监听器确认位点，中途进程退出时未确认记录会被重投。</p>
 */
@Service
public class FeedEventConsumer {
    private static final Logger log = LoggerFactory.getLogger(FeedEventConsumer.class);

    private final EventCodec codec;
    private final EventValidator validator;
    private final FeedCacheUpdater cacheUpdater;
    private final DeadLetterSink deadLetterSink;
    private final PipelineProperties.Consumer props;

    public FeedEventConsumer(EventCodec codec,
                             EventValidator validator,
                             FeedCacheUpdater cacheUpdater,
                             @Qualifier("feedEventsDeadLetterSink") DeadLetterSink deadLetterSink,
                             PipelineProperties properties) {
        this.codec = codec;
        this.validator = validator;
        this.cacheUpdater = cacheUpdater;
        this.deadLetterSink = deadLetterSink;
        this.props = properties.getConsumer();
    }

    /**
     * 处理并上报一批已拉取的记录。
     * @param batch 按到达顺序排列的记录
     * @return 本批汇总
     * @throws RuntimeException 批级失败（如死信不可达），此时本批不得确认，由容器错误处理器退避后重投
     */
    public ConsumeSummary handle(List<LogRecord> batch) {
        if (batch.isEmpty()) {
            return ConsumeSummary.idle();
        }
        long start = System.currentTimeMillis();

        BatchResult<RecordFailure> result = processBatch(batch);
        List<RecordFailure> exhausted = new ArrayList<>();
        List<RecordFailure> pendingRetry = new ArrayList<>();
        for (RecordFailure f : result.failedItems()) {
            (f.retryable() ? pendingRetry : exhausted).add(f);
        }

        // 仅重投失败子集，直到成功或用完重试预算
        int attempts = 1;
        int redelivered = 0;
        while (!pendingRetry.isEmpty() && attempts < props.getMaxAttempts()) {
            attempts++;
            List<LogRecord> again = new ArrayList<>(pendingRetry.size());
            for (RecordFailure f : pendingRetry) {
                again.add(f.record());
            }
            redelivered += again.size();
            BatchResult<RecordFailure> retry = processBatch(again);
            pendingRetry = new ArrayList<>();
            for (RecordFailure f : retry.failedItems()) {
                (f.retryable() ? pendingRetry : exhausted).add(f);
            }
        }

        int deadLettered = 0;
        for (RecordFailure f : exhausted) {
            deadLetterSink.send(f.record(), f.reason(), 1);
            deadLettered++;
        }
        for (RecordFailure f : pendingRetry) {
            deadLetterSink.send(f.record(), f.reason(), attempts);
            deadLettered++;
        }

        int succeeded = batch.size() - deadLettered;
        long duration = System.currentTimeMillis() - start;
        log.info("feed.consume fetched={} success={} failedFirstPass={} redelivered={} deadLettered={} durationMs={}",
                batch.size(), succeeded, result.failedCount(), redelivered, deadLettered, duration);
        if (result.failedCount() * 2 > batch.size()) {
            // 系统性故障（如缓存不可达）表现为批内失败率升高，由外部告警感知
            log.warn("feed.consume elevated failure rate failed={} fetched={}", result.failedCount(), batch.size());
        }
        return new ConsumeSummary(batch.size(), succeeded, redelivered, deadLettered);
    }

    /**
     * 处理一批记录，返回失败子集。单条记录的任何失败都不会中断同批其他记录。
     * @param records 按到达顺序排列的记录
     * @return 成功数、失败数与失败记录
     */
    public BatchResult<RecordFailure> processBatch(List<LogRecord> records) {
        BatchResult.Accumulator<RecordFailure> acc = new BatchResult.Accumulator<>();
        for (LogRecord record : records) {
            RecordFailure failure = processRecord(record);
            if (failure == null) {
                acc.succeeded(1);
            } else {
                acc.failed(failure);
            }
        }
        return acc.build();
    }

    private RecordFailure processRecord(LogRecord record) {
        DomainEvent event;
        try {
            event = codec.decode(record.data());
        } catch (IOException | RuntimeException e) {
            // 格式错误的负载以 {raw: ...} 形式留痕，不阻塞相邻记录
            log.error("feed.consume malformed payload seq={} payload={} err={}",
                    record.sequenceToken(), codec.rawEnvelope(record.text()), e.getMessage());
            return new RecordFailure(record, "malformed: " + e.getMessage(), false);
        }

        List<String> violations = validator.violations(event);
        if (!violations.isEmpty()) {
            log.error("feed.consume invalid event seq={} eventId={} violations={}",
                    record.sequenceToken(), event.eventId(), violations);
            return new RecordFailure(record, "invalid: " + String.join("; ", violations), false);
        }

        try {
            String outcome = cacheUpdater.apply(event);
            log.debug("feed.consume applied seq={} eventId={} type={} outcome={}",
                    record.sequenceToken(), event.eventId(), event.eventType(), outcome);
            return null;
        } catch (RuntimeException e) {
            log.warn("feed.consume apply failed seq={} eventId={} type={} err={}",
                    record.sequenceToken(), event.eventId(), event.eventType(), e.getMessage());
            return new RecordFailure(record, e.getClass().getSimpleName() + ": " + e.getMessage(), true);
        }
    }
}
