package com.lml.reservation.infra.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lml.reservation.application.notify.SeatStatusChanged;
import com.lml.reservation.application.notify.SeatStatusNotifier;
import com.lml.reservation.domain.outbox.OutboxEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 멀티 인스턴스용. 좌석 변경과 같은 트랜잭션에 outbox row 를 남기고,
 * OutboxPublisher 가 Kafka 로 옮긴다. 롤백되면 row 도 같이 사라진다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ticketing.notifier.mode", havingValue = "kafka")
public class OutboxSeatStatusNotifier implements SeatStatusNotifier {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Value("${ticketing.notifier.topic:seat.status.changed.v1}")
    private String topic;

    @Value("${ticketing.outbox.max-retry:10}")
    private int maxRetry;

    @Override
    public void publish(Long showId, List<SeatStatusChanged> changes) {
        if (changes.isEmpty()) return;

        SeatStatusMessage message = new SeatStatusMessage(UUID.randomUUID().toString(), showId, changes);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("seat status message serialization failed. showId=" + showId, e);
        }

        outboxEventRepository.save(OutboxEvent.pending(topic, String.valueOf(showId), payload, maxRetry,
                LocalDateTime.now()));
    }
}
