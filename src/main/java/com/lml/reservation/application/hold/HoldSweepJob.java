package com.lml.reservation.application.hold;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ticketing.hold.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class HoldSweepJob {

    private final HoldSweeper sweeper;

    @Scheduled(fixedDelayString = "${ticketing.hold.sweep.interval-ms:15000}")
    public void sweep() {
        sweeper.sweepExpired();
    }
}
