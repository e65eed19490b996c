package com.lml.reservation.infra.sse;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 공연별 keep-alive ping. 프록시가 idle 연결을 끊지 않게 하고,
 * 이미 끊긴 연결은 ping 실패로 걸러낸다.
 */
@Slf4j
@Component
public class SeatSsePingScheduler {

    private final SeatSseHub hub;
    private final MeterRegistry meterRegistry;

    public SeatSsePingScheduler(SeatSseHub hub, MeterRegistry meterRegistry) {
        this.hub = hub;
        this.meterRegistry = meterRegistry;
        Gauge.builder("ticketing.sse.subscribers", hub, SeatSseHub::totalSubscribers)
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${ticketing.sse.ping-interval-ms:15000}")
    public void ping() {
        int dropped = 0;
        for (Long showId : hub.showIds()) {
            int before = hub.subscriberCount(showId);
            hub.ping(showId);
            dropped += before - hub.subscriberCount(showId);
        }
        if (dropped > 0) {
            meterRegistry.counter("ticketing.sse.dropped").increment(dropped);
            log.debug("sse connections dropped on ping. count={}", dropped);
        }
    }
}
