package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.model.EventType;
import com.clipsmaster.fuse.model.FuseEvent;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KafkaEventPublisherTest {

    private static FuseEvent event(String id) {
        return new FuseEvent(id, EventType.FUSE_TRIGGERED.value(), 1_700_000_000_000L,
                Map.of(), Map.of("level", "CRITICAL"), List.of());
    }

    @Test
    void eventsAreStoredLocallyAndPublishedAsJson() {
        MockProducer<String, String> producer =
                new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        MemoryEventStorage local = new MemoryEventStorage();
        KafkaEventPublisher publisher = new KafkaEventPublisher(local, producer, "fuse-events");

        assertThat(publisher.store(event("e1"))).isEqualTo("e1");

        assertThat(local.get("e1")).isNotNull();
        assertThat(publisher.get("e1")).isEqualTo(local.get("e1"));
        List<ProducerRecord<String, String>> sent = producer.history();
        assertThat(sent).singleElement().satisfies(record -> {
            assertThat(record.topic()).isEqualTo("fuse-events");
            assertThat(record.key()).isEqualTo("fuse_triggered");
            assertThat(record.value()).contains("\"event_id\":\"e1\"", "\"level\":\"CRITICAL\"");
        });
        assertThat(publisher.getSentCount()).isEqualTo(1);
    }

    @Test
    void publishFailureDoesNotAffectLocalStore() {
        MockProducer<String, String> producer =
                new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        MemoryEventStorage local = new MemoryEventStorage();
        KafkaEventPublisher publisher = new KafkaEventPublisher(local, producer, "fuse-events");

        publisher.store(event("e1"));
        producer.errorNext(new RuntimeException("broker down"));

        assertThat(local.size()).isEqualTo(1);
        assertThat(publisher.getFailedCount()).isEqualTo(1);
        assertThat(publisher.getSentCount()).isZero();
    }

    @Test
    void closeClosesProducerAndDelegate() {
        MockProducer<String, String> producer =
                new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        MemoryEventStorage local = new MemoryEventStorage();
        KafkaEventPublisher publisher = new KafkaEventPublisher(local, producer, "fuse-events");
        publisher.store(event("e1"));

        publisher.close();

        assertThat(producer.closed()).isTrue();
        assertThat(local.size()).isZero();
    }
}
