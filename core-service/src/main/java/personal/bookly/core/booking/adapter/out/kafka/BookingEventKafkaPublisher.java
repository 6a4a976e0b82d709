package personal.bookly.core.booking.adapter.out.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.application.port.out.BookingEventPort;
import personal.bookly.core.booking.domain.model.BookingChangedEvent;
import personal.bookly.core.config.BooklyProperties;

/**
 * Booking Event Kafka Publisher (Adapter Layer)
 * booking.changed 토픽으로 JSON 이벤트 발행, key는 tenantId (테넌트 단위 순서 보장)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventKafkaPublisher implements BookingEventPort {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final BooklyProperties properties;

    @Override
    public void publish(BookingChangedEvent event) {
        String topic = properties.signal().bookingChangedTopic();
        String key = String.valueOf(event.tenantId());
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize booking event: bookingId={}", event.bookingId(), e);
            return;
        }

        log.debug("Publishing booking event: topic={}, key={}, bookingId={}", topic, key, event.bookingId());
        kafkaTemplate.send(topic, key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish booking event: topic={}, bookingId={}, error={}",
                                topic, event.bookingId(), ex.getMessage());
                    } else {
                        log.debug("Booking event published: topic={}, bookingId={}", topic, event.bookingId());
                    }
                });
    }
}
