package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.core.EventStorage;
import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Kafka事件转发器。
 * 包装一个本地事件存储：事件先落本地，再以JSON推送到Kafka Topic，
 * 供外部监控平台汇总。推送失败只记录日志，不影响本地存储。
 *
 * 消息格式：key为事件类型，value为事件JSON
 * {"event_id":"...","event_type":"fuse_triggered","timestamp":1708128000000,...}
 */
public class KafkaEventPublisher implements EventStorage {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    private final EventStorage delegate;
    private final Producer<String, String> producer;
    private final String topic;
    private final ObjectMapper mapper = new ObjectMapper();

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public KafkaEventPublisher(EventStorage delegate, Producer<String, String> producer, String topic) {
        this.delegate = delegate;
        this.producer = producer;
        this.topic = topic;
    }

    public static KafkaEventPublisher create(EventStorage delegate, String bootstrapServers, String topic) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "1");
        props.put(ProducerConfig.LINGER_MS_CONFIG, "50");
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, "2000");

        log.info("KafkaEventPublisher created. Servers: {}, Topic: {}", bootstrapServers, topic);
        return new KafkaEventPublisher(delegate, new KafkaProducer<>(props), topic);
    }

    @Override
    public String store(FuseEvent event) {
        String id = delegate.store(event);
        publish(event);
        return id;
    }

    private void publish(FuseEvent event) {
        String json;
        try {
            json = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            failedCount.incrementAndGet();
            log.error("Failed to serialize event {} for Kafka: {}", event.getEventId(), e.getMessage());
            return;
        }

        try {
            producer.send(new ProducerRecord<>(topic, event.getEventType(), json), (metadata, exception) -> {
                if (exception != null) {
                    failedCount.incrementAndGet();
                    log.warn("Failed to publish event {} to topic {}: {}",
                            event.getEventId(), topic, exception.getMessage());
                } else {
                    sentCount.incrementAndGet();
                }
            });
        } catch (Exception e) {
            failedCount.incrementAndGet();
            log.warn("Kafka send rejected for event {}: {}", event.getEventId(), e.getMessage());
        }
    }

    @Override
    public FuseEvent get(String eventId) {
        return delegate.get(eventId);
    }

    @Override
    public List<FuseEvent> query(EventQuery query, TimeRange timeRange, int limit) {
        return delegate.query(query, timeRange, limit);
    }

    @Override
    public List<FuseEvent> findReferencing(String eventId) {
        return delegate.findReferencing(eventId);
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public void close() {
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Error while closing Kafka producer: {}", e.getMessage());
        }
        log.info("KafkaEventPublisher stopped. Sent: {}, failed: {}", sentCount.get(), failedCount.get());
        delegate.close();
    }

    public long getSentCount() { return sentCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
}
