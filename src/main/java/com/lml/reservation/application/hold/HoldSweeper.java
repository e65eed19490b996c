package com.lml.reservation.application.hold;

import com.lml.reservation.common.retry.TransientRetry;
import com.lml.reservation.domain.hold.Hold;
import com.lml.reservation.domain.hold.SeatLockStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 만료된 ACTIVE 홀드 회수.
 * 한 번에 큰 UPDATE 를 치면 데드락이 잦아서 홀드 하나당 짧은 트랜잭션으로 나눈다.
 * 여러 인스턴스가 동시에 돌려도 된다 (HoldManager.expire 가 잠근 뒤 상태를 다시 본다).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldSweeper {

    private final HoldManager holdManager;
    private final SeatLockStore seatLockStore;
    private final TransientRetry retry;
    private final MeterRegistry meterRegistry;

    @Value("${ticketing.hold.sweep.batch-size:200}")
    private int batchSize;

    /**
     * @return 이번 스윕에서 만료 처리한 홀드 수
     */
    public int sweepExpired() {
        int released = 0;
        Set<Long> seen = new HashSet<>();

        while (true) {
            List<Long> batch = holdManager.findExpiredHoldIds(batchSize);
            List<Long> fresh = batch.stream().filter(seen::add).toList();
            if (fresh.isEmpty()) {
                break;
            }

            for (Long holdId : fresh) {
                try {
                    Optional<Hold> expired = retry.call("sweep.expire", () -> holdManager.expire(holdId));
                    if (expired.isPresent()) {
                        released++;
                        Hold h = expired.get();
                        seatLockStore.releaseSeats(h.getShowId(), h.getSeatIds(), h.getSessionToken());
                    }
                } catch (RuntimeException e) {
                    // 다음 스윕에서 다시 잡힌다
                    log.warn("sweep failed for hold. holdId={}, err={}", holdId, e.toString());
                    meterRegistry.counter("ticketing.sweep.failures").increment();
                }
            }

            if (batch.size() < batchSize) {
                break;
            }
        }

        if (released > 0) {
            log.info("expired holds swept. count={}", released);
        }
        meterRegistry.counter("ticketing.sweep.expired").increment(released);
        return released;
    }
}
