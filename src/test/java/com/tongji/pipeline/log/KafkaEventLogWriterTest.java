package com.tongji.pipeline.log;

import com.tongji.pipeline.event.EventTopics;
import com.tongji.pipeline.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaEventLogWriter Unit Tests")
class KafkaEventLogWriterTest {

    @Mock
    private KafkaTemplate<String, byte[]> kafka;

    private KafkaEventLogWriter writer;

    @BeforeEach
    void setUp() {
        writer = new KafkaEventLogWriter(kafka, TestFixtures.properties());
    }

    private static CompletableFuture<SendResult<String, byte[]>> failed(String message) {
        CompletableFuture<SendResult<String, byte[]>> f = new CompletableFuture<>();
        f.completeExceptionally(new IllegalStateException(message));
        return f;
    }

    @Test
    @DisplayName("should send to the feed topic keyed by partition key")
    void shouldWriteKeyed() {
        byte[] data = {1, 2};
        when(kafka.send(EventTopics.FEED_EVENTS, "e-1", data)).thenReturn(CompletableFuture.completedFuture(null));

        writer.write("e-1", data);

        verify(kafka).send(EventTopics.FEED_EVENTS, "e-1", data);
    }

    @Test
    @DisplayName("should wrap a rejected send in EventLogException")
    void shouldWrapRejectedSend() {
        when(kafka.send(eq(EventTopics.FEED_EVENTS), eq("e-1"), any(byte[].class))).thenReturn(failed("not leader"));

        assertThatThrownBy(() -> writer.write("e-1", new byte[0]))
                .isInstanceOf(EventLogException.class)
                .hasRootCauseMessage("not leader");
    }

    @Test
    @DisplayName("should report per-record errors aligned with the input")
    void shouldReportPerRecordErrors() {
        when(kafka.send(eq(EventTopics.FEED_EVENTS), eq("a"), any(byte[].class))).thenReturn(CompletableFuture.completedFuture(null));
        when(kafka.send(eq(EventTopics.FEED_EVENTS), eq("b"), any(byte[].class))).thenReturn(failed("record too large"));

        WriteBatchResult result = writer.writeBatch(List.of(new LogEntry("a", new byte[0]), new LogEntry("b", new byte[0])));

        assertThat(result.failedCount()).isEqualTo(1);
        assertThat(result.failed(0)).isFalse();
        assertThat(result.failed(1)).isTrue();
        assertThat(result.perRecordErrors().get(1)).contains("record too large");
        verify(kafka).flush();
    }

    @Test
    @DisplayName("should fail the whole batch when submission throws")
    void shouldFailWholeBatch() {
        when(kafka.send(eq(EventTopics.FEED_EVENTS), eq("a"), any(byte[].class))).thenThrow(new IllegalStateException("producer closed"));

        assertThatThrownBy(() -> writer.writeBatch(List.of(new LogEntry("a", new byte[0]))))
                .isInstanceOf(EventLogException.class);
    }
}
