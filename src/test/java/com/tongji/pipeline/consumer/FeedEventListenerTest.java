package com.tongji.pipeline.consumer;

import com.tongji.pipeline.log.EventLogException;
import com.tongji.pipeline.log.LogRecord;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FeedEventListener Unit Tests")
class FeedEventListenerTest {

    @Mock
    private FeedEventConsumer consumer;

    @Mock
    private Acknowledgment ack;

    @InjectMocks
    private FeedEventListener listener;

    private static ConsumerRecord<String, byte[]> record(int partition, long offset, String key) {
        return new ConsumerRecord<>("feed-events", partition, offset, key, ("{\"k\":\"" + key + "\"}").getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should hand the whole batch to the consumer in order and then acknowledge")
    @SuppressWarnings("unchecked")
    void shouldHandleBatchThenAcknowledge() {
        when(consumer.handle(anyList())).thenReturn(new ConsumeSummary(2, 2, 0, 0));

        listener.onMessages(List.of(record(0, 7, "e1"), record(0, 8, "e2")), ack);

        ArgumentCaptor<List<LogRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(consumer).handle(captor.capture());
        assertThat(captor.getValue()).extracting(LogRecord::partitionKey).containsExactly("e1", "e2");
        assertThat(captor.getValue()).extracting(LogRecord::sequenceToken).containsExactly("0-7", "0-8");
        assertThat(captor.getValue().get(0).text()).isEqualTo("{\"k\":\"e1\"}");
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("should not acknowledge when the batch fails")
    void shouldNotAcknowledgeOnBatchFailure() {
        when(consumer.handle(anyList())).thenThrow(new EventLogException("dlq down"));

        assertThatThrownBy(() -> listener.onMessages(List.of(record(1, 3, "e1")), ack))
                .isInstanceOf(EventLogException.class);

        verifyNoInteractions(ack);
    }
}
