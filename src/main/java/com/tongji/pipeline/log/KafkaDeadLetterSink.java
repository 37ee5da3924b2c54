package com.tongji.pipeline.log;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 死信主题投递：原始字节原样写入指定死信主题，失败原因、原位置与尝试次数放在消息头。
 * 每个死信主题一个实例，见 {@code KafkaConfig}。
 */
@Slf4j
public class KafkaDeadLetterSink implements DeadLetterSink {
    static final String HEADER_REASON = "dlq-reason";
    static final String HEADER_SEQUENCE = "dlq-sequence";
    static final String HEADER_ATTEMPTS = "dlq-attempts";

    private final KafkaTemplate<String, byte[]> kafka;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaDeadLetterSink(KafkaTemplate<String, byte[]> kafka, String topic, Duration sendTimeout) {
        this.kafka = kafka;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void send(LogRecord record, String reason, int attempts) {
        ProducerRecord<String, byte[]> msg = new ProducerRecord<>(topic, record.partitionKey(), record.data());
        msg.headers().add(new RecordHeader(HEADER_REASON, utf8(reason)));
        msg.headers().add(new RecordHeader(HEADER_SEQUENCE, utf8(record.sequenceToken())));
        msg.headers().add(new RecordHeader(HEADER_ATTEMPTS, utf8(String.valueOf(attempts))));
        try {
            kafka.send(msg).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.warn("Dead-lettered record topic={} seq={} key={} attempts={} reason={}", topic, record.sequenceToken(), record.partitionKey(), attempts, reason);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventLogException("Interrupted while dead-lettering " + record.sequenceToken(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new EventLogException("Dead-letter send failed for " + record.sequenceToken(), e);
        }
    }

    private static byte[] utf8(String s) {
        return (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
    }
}
