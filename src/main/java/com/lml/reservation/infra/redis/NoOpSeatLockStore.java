package com.lml.reservation.infra.redis;

import com.lml.reservation.domain.hold.SeatLockStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * 캐시를 끈 경우. 모든 판정을 DB 트랜잭션에 맡긴다.
 */
@Component
@ConditionalOnProperty(name = "ticketing.hold.cache.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSeatLockStore implements SeatLockStore {

    @Override
    public Set<Long> lockSeats(long showId, Collection<Long> seatIds, String owner, long ttlSeconds) {
        return Set.of();
    }

    @Override
    public void releaseSeats(long showId, Collection<Long> seatIds, String owner) {
    }

    @Override
    public void extendSeats(long showId, Collection<Long> seatIds, String owner, long ttlSeconds) {
    }
}
