package com.tongji.pipeline.log;

import com.tongji.pipeline.config.PipelineProperties;
import com.tongji.pipeline.event.EventTopics;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Kafka 的事件日志写入实现。
 *
 * <p>写入同步等待 Broker 确认（超时即视为失败）；批量写入先全部提交再逐条收集确认，
 * 单条失败只影响该条，提交阶段抛出的异常视为整批失败。</p>
 */
@Component
public class KafkaEventLogWriter implements EventLogWriter {
    private final KafkaTemplate<String, byte[]> kafka;
    private final Duration sendTimeout;

    public KafkaEventLogWriter(KafkaTemplate<String, byte[]> kafka, PipelineProperties properties) {
        this.kafka = kafka;
        this.sendTimeout = properties.getPublisher().getSendTimeout();
    }

    @Override
    public void write(String partitionKey, byte[] data) {
        try {
            kafka.send(EventTopics.FEED_EVENTS, partitionKey, data)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventLogException("Interrupted while writing key " + partitionKey, e);
        } catch (ExecutionException e) {
            throw new EventLogException("Write rejected for key " + partitionKey, e.getCause());
        } catch (TimeoutException e) {
            throw new EventLogException("Write timed out for key " + partitionKey, e);
        } catch (RuntimeException e) {
            throw new EventLogException("Write failed for key " + partitionKey, e);
        }
    }

    @Override
    public WriteBatchResult writeBatch(List<LogEntry> entries) {
        List<CompletableFuture<SendResult<String, byte[]>>> futures = new ArrayList<>(entries.size());
        try {
            for (LogEntry entry : entries) {
                futures.add(kafka.send(EventTopics.FEED_EVENTS, entry.partitionKey(), entry.data()));
            }
            kafka.flush();
        } catch (RuntimeException e) {
            throw new EventLogException("Batch submission failed", e);
        }

        long deadline = System.nanoTime() + sendTimeout.toNanos();
        List<String> errors = new ArrayList<>(entries.size());
        int failed = 0;
        for (CompletableFuture<SendResult<String, byte[]>> f : futures) {
            String error = null;
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                f.get(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = "interrupted";
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            } catch (TimeoutException e) {
                error = "timeout";
            }
            if (error != null) {
                failed++;
            }
            errors.add(error);
        }
        return new WriteBatchResult(failed, errors);
    }
}
