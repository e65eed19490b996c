package com.lml.reservation.infra.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lml.reservation.application.notify.SeatStatusChanged;
import com.lml.reservation.domain.seat.SeatStatus;
import com.lml.reservation.infra.outbox.SeatStatusMessage;
import com.lml.reservation.infra.sse.SeatSseHub;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SeatStatusChangedConsumerTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final SeatSseHub hub = mock(SeatSseHub.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final SeatStatusChangedConsumer consumer = new SeatStatusChangedConsumer(objectMapper, hub, meterRegistry);

    @Test
    @DisplayName("outbox 메시지를 받으면 이 인스턴스 SSE 허브로 넘긴다")
    void delivered() throws Exception {
        SeatStatusChanged change = new SeatStatusChanged(3L, 30L, SeatStatus.SOLD, null, LocalDateTime.now());
        String payload = objectMapper.writeValueAsString(new SeatStatusMessage("evt-1", 3L, List.of(change)));

        consumer.onMessage(payload);

        verify(hub).publish(eq(3L), eq(List.of(change)));
        assertThat(meterRegistry.counter("ticketing.notifier.delivered").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("깨진 payload 는 건너뛰고 카운트만 올린다")
    void invalidPayload_skipped() {
        consumer.onMessage("{not-json");
        consumer.onMessage("{\"eventId\":\"evt-2\",\"showId\":3,\"changes\":[]}");

        verify(hub, never()).publish(anyLong(), any());
        assertThat(meterRegistry.counter("ticketing.notifier.skip", "reason", "invalid_payload").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("ticketing.notifier.skip", "reason", "invalid_fields").count()).isEqualTo(1.0);
    }
}
