package com.lml.reservation.infra.sse;

import com.lml.reservation.application.notify.SeatStatusChanged;
import com.lml.reservation.domain.seat.SeatStatus;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SeatSseHubTest {

    private final SeatSseHub hub = new SeatSseHub();

    @Test
    void subscribe_registersPerShow() {
        SseEmitter a = hub.subscribe(1L);
        hub.subscribe(1L);
        hub.subscribe(2L);

        assertThat(a).isNotNull();
        assertThat(hub.subscriberCount(1L)).isEqualTo(2);
        assertThat(hub.subscriberCount(2L)).isEqualTo(1);
        assertThat(hub.subscriberCount(3L)).isZero();
    }

    @Test
    void publish_withoutSubscribers_isNoop() {
        List<SeatStatusChanged> changes = List.of(
                new SeatStatusChanged(9L, 1L, SeatStatus.HELD, 5L, LocalDateTime.now()));

        assertThatCode(() -> hub.publish(9L, changes)).doesNotThrowAnyException();
        assertThatCode(() -> hub.ping(9L)).doesNotThrowAnyException();
        assertThat(hub.showIds()).isEmpty();
    }

    @Test
    void publish_toSubscribers_doesNotDropLiveConnections() {
        hub.subscribe(1L);

        hub.publish(1L, List.of(new SeatStatusChanged(1L, 3L, SeatStatus.AVAILABLE, null, LocalDateTime.now())));
        hub.ping(1L);

        assertThat(hub.subscriberCount(1L)).isEqualTo(1);
    }
}
