package com.tongji.pipeline.config;

import com.tongji.pipeline.event.EventTopics;
import com.tongji.pipeline.log.DeadLetterSink;
import com.tongji.pipeline.log.KafkaDeadLetterSink;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

import java.util.Map;

/**
 * 事件日志配置：键为字符串（eventId），值为原始字节（JSON）。
 * 消费端关闭自动提交，由批量监听器在处理完成后手动提交位点。
 * 单批条数由 max.poll.records 约束；Broker 端凑批由 fetch.min.bytes 与 fetch.max.wait.ms 约束，
 * 即数据不足时最多等待 maxWait 再返回。
 */
@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, byte[]> eventProducerFactory(KafkaProperties properties, SslBundles sslBundles) {
        var props = properties.buildProducerProperties(sslBundles);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), new ByteArraySerializer());
    }

    @Bean
    public KafkaTemplate<String, byte[]> eventKafkaTemplate(ProducerFactory<String, byte[]> pf) {
        return new KafkaTemplate<>(pf);
    }

    /** Feed 事件死信：格式错误或耗尽重试的事件。 */
    @Bean
    public DeadLetterSink feedEventsDeadLetterSink(KafkaTemplate<String, byte[]> eventKafkaTemplate, PipelineProperties pipeline) {
        return new KafkaDeadLetterSink(eventKafkaTemplate, EventTopics.FEED_EVENTS_DLQ, pipeline.getPublisher().getSendTimeout());
    }

    /** 变更流死信：计数更新耗尽重试的关系行变更。 */
    @Bean
    public DeadLetterSink relationshipChangesDeadLetterSink(KafkaTemplate<String, byte[]> eventKafkaTemplate, PipelineProperties pipeline) {
        return new KafkaDeadLetterSink(eventKafkaTemplate, EventTopics.RELATIONSHIP_CHANGES_DLQ, pipeline.getPublisher().getSendTimeout());
    }

    @Bean
    public ConsumerFactory<String, byte[]> eventConsumerFactory(KafkaProperties properties,
                                                               SslBundles sslBundles,
                                                               PipelineProperties pipeline) {
        Map<String, Object> props = properties.buildConsumerProperties(sslBundles);
        PipelineProperties.Consumer consumer = pipeline.getConsumer();
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, consumer.getMaxRecords());
        props.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, consumer.getFetchMinBytes());
        props.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, (int) consumer.getMaxWait().toMillis());
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), new ByteArrayDeserializer());
    }

    /**
     * Feed 事件批量监听容器：批量投递、手动确认；批级异常按固定间隔退避后重投整批。
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, byte[]> feedEventListenerContainerFactory(
            ConsumerFactory<String, byte[]> eventConsumerFactory,
            PipelineProperties pipeline) {
        PipelineProperties.Consumer consumer = pipeline.getConsumer();
        ConcurrentKafkaListenerContainerFactory<String, byte[]> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(eventConsumerFactory);
        factory.setBatchListener(true);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.getContainerProperties().setPollTimeout(consumer.getMaxWait().toMillis());
        factory.setCommonErrorHandler(new DefaultErrorHandler(
                new FixedBackOff(consumer.getFailureBackoff().toMillis(), FixedBackOff.UNLIMITED_ATTEMPTS)));
        return factory;
    }
}
