package com.lml.reservation.application.seat;

import com.lml.reservation.domain.hold.Hold;
import com.lml.reservation.domain.seat.Seat;
import com.lml.reservation.domain.seat.SeatStatus;
import com.lml.reservation.infra.hold.HoldJpaRepository;
import com.lml.reservation.infra.seat.SeatJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 읽기 전용 좌석 인벤토리.
 * HELD 로 저장돼 있어도 홀드가 살아있지 않으면 AVAILABLE 로 보여준다.
 */
@Service
@RequiredArgsConstructor
public class SeatInventoryService {

    private final SeatJpaRepository seatRepository;
    private final HoldJpaRepository holdRepository;

    @Transactional(readOnly = true)
    public List<SeatSnapshot> getSeatsForShow(Long showId) {
        List<Seat> seats = seatRepository.findByShowIdOrderBySectionIdAscRowAscNumberAsc(showId);
        return toSnapshots(seats, LocalDateTime.now());
    }

    @Transactional(readOnly = true)
    public List<SeatSnapshot> getSeats(Long showId, Collection<Long> seatIds) {
        List<Seat> seats = seatRepository.findByShowIdAndIdIn(showId, seatIds);
        return toSnapshots(seats, LocalDateTime.now());
    }

    /**
     * 주어진 좌석 중 지금 잡을 수 없는 좌석 id.
     * 캐시 락 충돌을 DB 기준으로 다시 확인할 때 쓴다.
     */
    @Transactional(readOnly = true)
    public Set<Long> unavailableAmong(Long showId, Collection<Long> seatIds) {
        return getSeats(showId, seatIds).stream()
                .filter(s -> !s.isAvailable())
                .map(SeatSnapshot::seatId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private List<SeatSnapshot> toSnapshots(List<Seat> seats, LocalDateTime now) {
        Set<Long> holdIds = seats.stream()
                .map(Seat::getHoldId)
                .filter(id -> id != null)
                .collect(Collectors.toSet());
        Map<Long, Hold> holds = holdIds.isEmpty()
                ? Map.of()
                : holdRepository.findAllById(holdIds).stream()
                        .collect(Collectors.toMap(Hold::getId, Function.identity()));

        return seats.stream()
                .map(s -> new SeatSnapshot(s.getId(), s.getShowId(), s.getSectionId(), s.getRow(),
                        s.getNumber(), s.getPricePence(), s.isAccessible(), effectiveStatus(s, holds, now)))
                .toList();
    }

    static SeatStatus effectiveStatus(Seat seat, Map<Long, Hold> holds, LocalDateTime now) {
        if (seat.getStatus() != SeatStatus.HELD) {
            return seat.getStatus();
        }
        Hold hold = holds.get(seat.getHoldId());
        return hold != null && hold.isLive(now) ? SeatStatus.HELD : SeatStatus.AVAILABLE;
    }
}
