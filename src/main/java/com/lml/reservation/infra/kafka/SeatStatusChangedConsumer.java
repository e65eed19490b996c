package com.lml.reservation.infra.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lml.reservation.infra.outbox.SeatStatusMessage;
import com.lml.reservation.infra.sse.SeatSseHub;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * 모든 인스턴스가 같은 토픽을 각자 소비해서 자기 SSE 구독자에게 뿌린다.
 * 그래서 group id 가 인스턴스마다 달라야 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ticketing.notifier.mode", havingValue = "kafka")
public class SeatStatusChangedConsumer {

    private final ObjectMapper objectMapper;
    private final SeatSseHub hub;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            topics = "${ticketing.notifier.topic:seat.status.changed.v1}",
            groupId = "${ticketing.notifier.group-id-prefix:seat-sse}-${random.uuid}"
    )
    public void onMessage(String payload) {
        SeatStatusMessage message;
        try {
            message = objectMapper.readValue(payload, SeatStatusMessage.class);
        } catch (JsonProcessingException e) {
            meterRegistry.counter("ticketing.notifier.skip", "reason", "invalid_payload").increment();
            log.warn("Skip invalid seat status payload. payload={}", payload, e);
            return;
        }

        if (message.showId() == null || message.changes() == null || message.changes().isEmpty()) {
            meterRegistry.counter("ticketing.notifier.skip", "reason", "invalid_fields").increment();
            log.warn("Skip seat status message without changes. eventId={}", message.eventId());
            return;
        }

        hub.publish(message.showId(), message.changes());
        meterRegistry.counter("ticketing.notifier.delivered").increment();
    }
}
