package com.lml.reservation.domain.hold;

import java.util.Collection;
import java.util.Set;

/**
 * 공유 캐시 기반 좌석 선점 (DB 트랜잭션 앞단의 빠른 필터).
 * 정답은 항상 DB 이고, 이 저장소는 경합이 심한 좌석에서 DB 락 대기를 줄이는 용도다.
 */
public interface SeatLockStore {

    /**
     * 요청 좌석 전부를 owner 로 잠근다 (all-or-nothing).
     * @return 이미 다른 owner 가 잡고 있는 seatId. 비어 있으면 전부 잠금 성공
     */
    Set<Long> lockSeats(long showId, Collection<Long> seatIds, String owner, long ttlSeconds);

    /** owner 가 잡은 키만 지운다. */
    void releaseSeats(long showId, Collection<Long> seatIds, String owner);

    /** owner 가 잡은 키의 TTL 을 갱신한다. */
    void extendSeats(long showId, Collection<Long> seatIds, String owner, long ttlSeconds);
}
