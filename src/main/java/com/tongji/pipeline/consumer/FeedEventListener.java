package com.tongji.pipeline.consumer;

import com.tongji.pipeline.event.EventTopics;
import com.tongji.pipeline.log.LogRecord;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Feed 事件批量监听器。
 * 职责：由监听容器按批拉取（条数与等待时间受消费端配置约束），转换为日志记录交给 {@link FeedEventConsumer}；
 * 整批处理与死信写入完成后手动提交位点。批级异常不确认，由容器错误处理器退避后重投同一批。
 */
@Service
public class FeedEventListener {
    private final FeedEventConsumer consumer;

    public FeedEventListener(FeedEventConsumer consumer) {
        this.consumer = consumer;
    }

    /**
     * 消费一批 Feed 事件。
     * @param records 本次拉取的记录（同分区内按偏移有序）
     * @param ack 位点确认对象（手动提交）
     */
    @KafkaListener(topics = EventTopics.FEED_EVENTS,
            groupId = "${pipeline.consumer.group-id:feed-cache-consumer}",
            containerFactory = "feedEventListenerContainerFactory",
            autoStartup = "${pipeline.consumer.enabled:true}")
    public void onMessages(List<ConsumerRecord<String, byte[]>> records, Acknowledgment ack) {
        consumer.handle(toLogRecords(records));
        // 成功后提交位点，绑定“已处理或已转入死信”语义
        ack.acknowledge();
    }

    static List<LogRecord> toLogRecords(List<ConsumerRecord<String, byte[]>> records) {
        List<LogRecord> out = new ArrayList<>(records.size());
        for (ConsumerRecord<String, byte[]> r : records) {
            out.add(new LogRecord(r.key(), r.value(), r.partition() + "-" + r.offset()));
        }
        return out;
    }
}
