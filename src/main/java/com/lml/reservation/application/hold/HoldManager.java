package com.lml.reservation.application.hold;

import com.lml.reservation.application.ledger.ReservationLedger;
import com.lml.reservation.application.notify.SeatStatusChanged;
import com.lml.reservation.application.notify.SeatStatusNotifier;
import com.lml.reservation.application.rules.RejectReason;
import com.lml.reservation.application.rules.ValidationResult;
import com.lml.reservation.common.exception.BusinessException;
import com.lml.reservation.common.exception.ErrorCode;
import com.lml.reservation.domain.booking.Booking;
import com.lml.reservation.domain.hold.Hold;
import com.lml.reservation.domain.hold.HoldState;
import com.lml.reservation.domain.ledger.LedgerAction;
import com.lml.reservation.domain.seat.Seat;
import com.lml.reservation.domain.seat.SeatStatus;
import com.lml.reservation.infra.booking.BookingJpaRepository;
import com.lml.reservation.infra.hold.HoldJpaRepository;
import com.lml.reservation.infra.seat.SeatJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 좌석 status / holdId 와 Hold 생명주기를 바꾸는 유일한 곳.
 *
 * 락 순서: 좌석 row(id 오름차순) -> hold row.
 * 모든 메서드가 이 순서를 지켜서 tryHold / promote / release / 스윕끼리 데드락 순환이 생기지 않는다.
 * 충돌, 이미 종료된 홀드는 예외가 아니라 결과 값으로 돌려준다.
 * 트랜지언트 DB 오류 재시도는 호출하는 쪽(SeatHoldService 등)이 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldManager {

    private final SeatJpaRepository seatRepository;
    private final HoldJpaRepository holdRepository;
    private final BookingJpaRepository bookingRepository;
    private final ReservationLedger ledger;
    private final SeatStatusNotifier notifier;

    @Value("${ticketing.hold.ttl-seconds:900}")
    private long defaultTtlSeconds;

    @Value("${ticketing.hold.max-ttl-seconds:3600}")
    private long maxTtlSeconds;

    @Value("${ticketing.hold.max-renewals:3}")
    private int maxRenewals;

    /**
     * 요청 좌석 전부를 한 트랜잭션에서 잡거나, 하나도 건드리지 않는다.
     * 만료된 홀드가 잡고 있던 좌석은 새 홀드가 가져간다. 옛 홀드 자체는 스윕이 정리한다.
     */
    @Transactional
    public HoldResult tryHold(Long showId, Set<Long> seatIds, String sessionToken, String userId,
                              Long ttlSeconds) {
        if (showId == null || seatIds == null || seatIds.isEmpty()
                || sessionToken == null || sessionToken.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }

        Duration ttl = Duration.ofSeconds(clampTtl(ttlSeconds));

        List<Seat> seats = seatRepository.findForUpdate(showId, seatIds);
        if (seats.size() != seatIds.size()) {
            Set<Long> found = seats.stream().map(Seat::getId).collect(Collectors.toSet());
            Set<Long> unknown = seatIds.stream().filter(id -> !found.contains(id))
                    .collect(Collectors.toCollection(TreeSet::new));
            return HoldResult.invalid(ValidationResult.rejected(RejectReason.UNKNOWN_SEAT,
                    "공연에 없는 좌석입니다. seatIds=" + unknown));
        }

        Map<Long, Hold> holders = lockHolders(seats);
        // 만료 판단은 락을 다 잡은 뒤의 시각으로
        LocalDateTime now = LocalDateTime.now();

        Set<Long> conflicts = new TreeSet<>();
        Set<Long> reclaimed = new TreeSet<>();
        for (Seat seat : seats) {
            if (seat.getStatus() == SeatStatus.SOLD) {
                conflicts.add(seat.getId());
            } else if (seat.getStatus() == SeatStatus.HELD) {
                Hold holder = holders.get(seat.getHoldId());
                if (holder == null) {
                    throw new IllegalStateException("seat points to missing hold. seatId="
                            + seat.getId() + ", holdId=" + seat.getHoldId());
                }
                if (holder.isLive(now)) {
                    conflicts.add(seat.getId());
                } else {
                    reclaimed.add(holder.getId());
                }
            }
        }

        if (!conflicts.isEmpty()) {
            log.debug("hold conflict. showId={}, seatIds={}, conflicts={}", showId, seatIds, conflicts);
            ledger.record(LedgerAction.HOLD_CONFLICT, null, showId, seatIds, sessionToken,
                    "conflictSeatIds=" + conflicts);
            return HoldResult.conflict(conflicts);
        }

        Hold hold = holdRepository.save(Hold.newHold(showId, seatIds, sessionToken, userId, now, ttl));
        List<SeatStatusChanged> changes = new ArrayList<>();
        for (Seat seat : seats) {
            seat.hold(hold.getId(), now);
            changes.add(new SeatStatusChanged(showId, seat.getId(), SeatStatus.HELD, hold.getId(), now));
        }

        ledger.record(LedgerAction.HOLD_GRANTED, hold.getId(), showId, hold.getSeatIds(), sessionToken,
                reclaimed.isEmpty() ? null : "reclaimedFromExpiredHolds=" + reclaimed);
        notifier.publish(showId, changes);

        log.info("hold granted. holdId={}, showId={}, seatIds={}, expiresAt={}",
                hold.getId(), showId, hold.getSeatIds(), hold.getExpiresAt());
        return HoldResult.granted(hold);
    }

    /**
     * 같은 세션의 살아있는 홀드만 원래 TTL 만큼 연장한다. 실패 시 아무것도 바꾸지 않는다.
     */
    @Transactional
    public boolean renew(Long holdId, String sessionToken) {
        Optional<Hold> found = holdRepository.findByIdForUpdate(holdId);
        LocalDateTime now = LocalDateTime.now();
        if (found.isEmpty() || !found.get().isOwnedBy(sessionToken)) {
            return false;
        }

        Hold hold = found.get();
        if (!hold.renew(now, maxRenewals)) {
            log.debug("renew refused. holdId={}, state={}, renewCount={}",
                    holdId, hold.effectiveState(now), hold.getRenewCount());
            return false;
        }

        ledger.record(LedgerAction.HOLD_RENEWED, holdId, hold.getShowId(), hold.getSeatIds(), sessionToken,
                "expiresAt=" + hold.getExpiresAt());
        return true;
    }

    /**
     * 클라이언트 해제. 이미 해제/만료된 홀드는 성공으로 본다.
     * 없는 홀드이거나 세션이 다르면 false.
     */
    @Transactional
    public boolean release(Long holdId, String sessionToken) {
        List<Seat> seats = seatRepository.findHeldByForUpdate(holdId);
        Optional<Hold> found = holdRepository.findByIdForUpdate(holdId);
        if (found.isEmpty() || !found.get().isOwnedBy(sessionToken)) {
            return false;
        }
        return close(found.get(), seats, "client release");
    }

    /**
     * 결제 실패 등 시스템 쪽 해제. 세션 확인 없이 같은 규칙으로 닫는다.
     */
    @Transactional
    public boolean releaseBySystem(Long holdId, String reason) {
        List<Seat> seats = seatRepository.findHeldByForUpdate(holdId);
        Optional<Hold> found = holdRepository.findByIdForUpdate(holdId);
        if (found.isEmpty()) {
            return false;
        }
        return close(found.get(), seats, "system: " + reason);
    }

    private boolean close(Hold hold, List<Seat> seats, String reason) {
        LocalDateTime now = LocalDateTime.now();

        if (hold.getState() == HoldState.PROMOTED) {
            // 결제 완료된 좌석은 풀 수 없다
            return false;
        }
        if (hold.getState().isTerminal()) {
            return true;
        }
        if (!hold.isLive(now)) {
            expireLocked(hold, seats, now);
            return true;
        }

        hold.release(now);
        List<Long> freed = freeSeats(hold, seats, now);
        ledger.record(LedgerAction.HOLD_RELEASED, hold.getId(), hold.getShowId(), freed,
                hold.getSessionToken(), reason);

        log.info("hold released. holdId={}, seatIds={}, reason={}", hold.getId(), freed, reason);
        return true;
    }

    /**
     * 결제 확정 후 호출. 좌석 -> SOLD, Booking 생성.
     * 홀드가 이미 살아있지 않으면 ALREADY_TERMINAL. 같은 홀드 재호출은 기존 Booking 을 돌려준다.
     */
    @Transactional
    public PromoteResult promote(Long holdId, String paymentReference, String customerEmail) {
        List<Seat> seats = seatRepository.findHeldByForUpdate(holdId);
        Hold hold = holdRepository.findByIdForUpdate(holdId)
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLD_NOT_FOUND));
        LocalDateTime now = LocalDateTime.now();

        if (hold.getState() == HoldState.PROMOTED) {
            Booking existing = bookingRepository.findByHoldId(holdId)
                    .orElseThrow(() -> new IllegalStateException("promoted hold without booking. holdId=" + holdId));
            return PromoteResult.alreadyPromoted(existing, hold);
        }

        if (!hold.isLive(now)) {
            if (hold.getState() == HoldState.ACTIVE) {
                // 스윕 전에 만료된 홀드. 여기서 바로 정리하고 좌석을 돌려준다.
                expireLocked(hold, seats, now);
            }
            log.warn("promote on terminal hold. holdId={}, state={}, expiresAt={}",
                    holdId, hold.getState(), hold.getExpiresAt());
            return PromoteResult.alreadyTerminal(hold);
        }

        Set<Long> locked = seats.stream().map(Seat::getId).collect(Collectors.toSet());
        if (!locked.equals(hold.getSeatIds())) {
            // 다른 홀드가 좌석을 이미 가져갔다. 이 홀드는 만료로 닫는다.
            log.warn("promote on hold that lost seats. holdId={}, expected={}, actual={}",
                    holdId, hold.getSeatIds(), locked);
            expireLocked(hold, seats, now);
            return PromoteResult.alreadyTerminal(hold);
        }

        long total = seats.stream().mapToLong(Seat::getPricePence).sum();
        Booking booking = bookingRepository.save(Booking.fromHold(holdId, hold.getShowId(), hold.getSeatIds(),
                hold.getUserId(), customerEmail, total, paymentReference, now));

        List<SeatStatusChanged> changes = new ArrayList<>();
        for (Seat seat : seats) {
            seat.sell(now);
            changes.add(new SeatStatusChanged(hold.getShowId(), seat.getId(), SeatStatus.SOLD, null, now));
        }
        hold.promote(now);

        ledger.record(LedgerAction.HOLD_PROMOTED, holdId, hold.getShowId(), hold.getSeatIds(),
                hold.getSessionToken(), "bookingId=" + booking.getId() + ", totalAmountPence=" + total);
        notifier.publish(hold.getShowId(), changes);

        log.info("hold promoted. holdId={}, bookingId={}, totalAmountPence={}", holdId, booking.getId(), total);
        return PromoteResult.promoted(booking, hold);
    }

    /**
     * 스윕 한 건. 다른 트랜잭션이 먼저 닫았으면 아무것도 하지 않는다.
     *
     * @return 이번 호출로 만료 처리된 홀드
     */
    @Transactional
    public Optional<Hold> expire(Long holdId) {
        List<Seat> seats = seatRepository.findHeldByForUpdate(holdId);
        Optional<Hold> found = holdRepository.findByIdForUpdate(holdId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        LocalDateTime now = LocalDateTime.now();

        Hold hold = found.get();
        if (hold.getState() != HoldState.ACTIVE || hold.isLive(now)) {
            return Optional.empty();
        }

        expireLocked(hold, seats, now);
        return Optional.of(hold);
    }

    @Transactional(readOnly = true)
    public List<Long> findExpiredHoldIds(int batchSize) {
        return holdRepository.findExpiredIds(LocalDateTime.now(), PageRequest.of(0, batchSize));
    }

    @Transactional(readOnly = true)
    public Optional<Hold> getHold(Long holdId) {
        return holdRepository.findById(holdId);
    }

    /**
     * null 이면 기본 TTL, 그 외에는 [1, max-ttl-seconds] 로 자른다. 0 이하는 잘못된 요청.
     */
    public long clampTtl(Long requested) {
        if (requested == null) {
            return defaultTtlSeconds;
        }
        if (requested <= 0) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST,
                    "ttlSeconds 는 1 이상이어야 합니다. ttlSeconds=" + requested);
        }
        return Math.min(requested, maxTtlSeconds);
    }

    private void expireLocked(Hold hold, List<Seat> seats, LocalDateTime now) {
        hold.expire(now);
        List<Long> freed = freeSeats(hold, seats, now);
        ledger.record(LedgerAction.HOLD_EXPIRED, hold.getId(), hold.getShowId(), freed,
                hold.getSessionToken(), "expiresAt=" + hold.getExpiresAt());
        log.info("hold expired. holdId={}, freedSeatIds={}", hold.getId(), freed);
    }

    // 이 홀드를 아직 가리키는 좌석만 푼다. 이미 다른 홀드가 가져간 좌석은 건드리지 않는다.
    private List<Long> freeSeats(Hold hold, List<Seat> seats, LocalDateTime now) {
        List<Long> freed = new ArrayList<>();
        List<SeatStatusChanged> changes = new ArrayList<>();
        for (Seat seat : seats) {
            if (!seat.isHeldBy(hold.getId())) {
                continue;
            }
            seat.free(now);
            freed.add(seat.getId());
            changes.add(new SeatStatusChanged(hold.getShowId(), seat.getId(), SeatStatus.AVAILABLE, null, now));
        }
        if (!changes.isEmpty()) {
            notifier.publish(hold.getShowId(), changes);
        }
        return freed;
    }

    private Map<Long, Hold> lockHolders(Collection<Seat> seats) {
        Set<Long> holderIds = seats.stream()
                .filter(s -> s.getStatus() == SeatStatus.HELD && s.getHoldId() != null)
                .map(Seat::getHoldId)
                .collect(Collectors.toCollection(TreeSet::new));
        if (holderIds.isEmpty()) {
            return Map.of();
        }
        return holdRepository.findAllByIdForUpdate(holderIds).stream()
                .collect(Collectors.toMap(Hold::getId, Function.identity()));
    }
}
