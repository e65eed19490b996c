package com.lml.reservation.application.hold;

import com.lml.reservation.application.rules.BusinessRulesValidator;
import com.lml.reservation.application.rules.SelectionConstraints;
import com.lml.reservation.application.rules.ValidationResult;
import com.lml.reservation.application.seat.SeatAliasResolver;
import com.lml.reservation.application.seat.SeatInventoryService;
import com.lml.reservation.common.exception.BusinessException;
import com.lml.reservation.common.exception.ErrorCode;
import com.lml.reservation.common.retry.TransientRetry;
import com.lml.reservation.domain.hold.Hold;
import com.lml.reservation.domain.hold.SeatLockStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 홀드 요청 흐름: 좌석 코드 해석 -> 규칙 검증 -> (선택) Redis 선점 -> HoldManager 트랜잭션.
 *
 * 여기서는 트랜잭션을 잡지 않는다.
 * - 락 대기 타임아웃/데드락은 새 트랜잭션으로 짧게 재시도
 * - Redis 선점은 경합을 앞단에서 줄이는 용도일 뿐, 판정은 DB 트랜잭션이 한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatHoldService {

    private final HoldManager holdManager;
    private final BusinessRulesValidator validator;
    private final SeatAliasResolver aliasResolver;
    private final SeatInventoryService inventoryService;
    private final SeatLockStore seatLockStore;
    private final TransientRetry retry;
    private final MeterRegistry meterRegistry;

    public HoldResult hold(HoldCommand command) {
        if (command.showId() == null || command.sessionToken() == null || command.sessionToken().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }
        Set<Long> seatIds = resolveSeatIds(command.showId(), command.seatIds(), command.seatCodes());

        SelectionConstraints constraints = command.constraints() == null
                ? SelectionConstraints.none() : command.constraints();
        ValidationResult validation = validator.validateSelection(command.showId(), seatIds, constraints);
        if (!validation.valid()) {
            count("invalid");
            return HoldResult.invalid(validation);
        }

        HoldResult result = tryHold(command.showId(), seatIds, command.sessionToken(), command.userId(),
                command.ttlSeconds());
        // 경고는 홀드를 막지 않고 응답에 같이 실어 보낸다
        return result.isGranted() ? result.withValidation(validation) : result;
    }

    /** 홀드 없이 검증만. 화면에서 좌석 고를 때 미리 보여주는 용도. */
    public ValidationResult validate(Long showId, List<Long> seatIds, List<String> seatCodes,
                                     SelectionConstraints constraints) {
        if (showId == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }
        return validator.validateSelection(showId, resolveSeatIds(showId, seatIds, seatCodes),
                constraints == null ? SelectionConstraints.none() : constraints);
    }

    public HoldResult tryHold(Long showId, Set<Long> seatIds, String sessionToken, String userId, Long ttlSeconds) {
        long ttl = holdManager.clampTtl(ttlSeconds);

        Set<Long> cacheConflicts = seatLockStore.lockSeats(showId, seatIds, sessionToken, ttl);
        if (!cacheConflicts.isEmpty()) {
            // 캐시 키가 남아 있어도 DB 기준으로 비어 있으면 진행한다
            Set<Long> confirmed = inventoryService.unavailableAmong(showId, cacheConflicts);
            if (!confirmed.isEmpty()) {
                count("conflict");
                return HoldResult.conflict(confirmed);
            }
            log.debug("stale seat lock keys ignored. showId={}, seatIds={}", showId, cacheConflicts);
        }

        HoldResult result;
        try {
            result = retry.call("tryHold",
                    () -> holdManager.tryHold(showId, seatIds, sessionToken, userId, ttlSeconds));
        } catch (RuntimeException e) {
            seatLockStore.releaseSeats(showId, seatIds, sessionToken);
            throw translate(e);
        }

        if (!result.isGranted()) {
            seatLockStore.releaseSeats(showId, seatIds, sessionToken);
        }
        count(result.outcome().name().toLowerCase());
        return result;
    }

    public boolean renew(Long holdId, String sessionToken) {
        boolean renewed;
        try {
            renewed = retry.call("renew", () -> holdManager.renew(holdId, sessionToken));
        } catch (RuntimeException e) {
            throw translate(e);
        }
        if (renewed) {
            holdManager.getHold(holdId).ifPresent(h ->
                    seatLockStore.extendSeats(h.getShowId(), h.getSeatIds(), sessionToken, remainingSeconds(h)));
        }
        return renewed;
    }

    public boolean release(Long holdId, String sessionToken) {
        boolean released;
        try {
            released = retry.call("release", () -> holdManager.release(holdId, sessionToken));
        } catch (RuntimeException e) {
            throw translate(e);
        }
        if (released) {
            // DB 커밋 이후에 캐시 키를 푼다
            holdManager.getHold(holdId).ifPresent(h ->
                    seatLockStore.releaseSeats(h.getShowId(), h.getSeatIds(), h.getSessionToken()));
        }
        return released;
    }

    public Optional<HoldView> getHold(Long holdId) {
        return holdManager.getHold(holdId).map(h -> HoldView.of(h, LocalDateTime.now()));
    }

    private Set<Long> resolveSeatIds(Long showId, List<Long> seatIds, List<String> seatCodes) {
        boolean hasIds = seatIds != null && !seatIds.isEmpty();
        boolean hasCodes = seatCodes != null && !seatCodes.isEmpty();
        if (hasIds == hasCodes) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "seatIds 또는 seatCodes 중 하나만 지정해주세요.");
        }
        if (hasCodes) {
            return aliasResolver.resolve(showId, seatCodes);
        }
        Set<Long> ids = new LinkedHashSet<>(seatIds);
        if (ids.contains(null) || ids.size() != seatIds.size()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "좌석 id 가 비어 있거나 중복되었습니다.");
        }
        return ids;
    }

    private static long remainingSeconds(Hold hold) {
        long seconds = Duration.between(LocalDateTime.now(), hold.getExpiresAt()).getSeconds();
        return Math.max(1, seconds);
    }

    private static RuntimeException translate(RuntimeException e) {
        if (TransientRetry.isTransient(e)) {
            return new BusinessException(ErrorCode.TRY_AGAIN, e);
        }
        return e;
    }

    private void count(String result) {
        meterRegistry.counter("ticketing.hold.requests", "result", result).increment();
    }
}
