package com.lml.reservation.application.payment;

import com.lml.reservation.application.hold.HoldManager;
import com.lml.reservation.application.hold.PromoteResult;
import com.lml.reservation.application.ledger.ReservationLedger;
import com.lml.reservation.common.exception.BusinessException;
import com.lml.reservation.common.exception.ErrorCode;
import com.lml.reservation.domain.booking.Booking;
import com.lml.reservation.domain.hold.Hold;
import com.lml.reservation.domain.ledger.LedgerAction;
import com.lml.reservation.domain.payment.PaymentAttempt;
import com.lml.reservation.domain.payment.PaymentAttemptState;
import com.lml.reservation.domain.payment.PaymentIntent;
import com.lml.reservation.domain.payment.PaymentOutcome;
import com.lml.reservation.domain.payment.ReconciliationCase;
import com.lml.reservation.domain.seat.Seat;
import com.lml.reservation.infra.booking.BookingJpaRepository;
import com.lml.reservation.infra.hold.HoldJpaRepository;
import com.lml.reservation.infra.payment.PaymentAttemptJpaRepository;
import com.lml.reservation.infra.payment.ReconciliationCaseJpaRepository;
import com.lml.reservation.infra.seat.SeatJpaRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PaymentAttempt 생명주기. 메서드 하나가 짧은 트랜잭션 하나.
 * 결제사 네트워크 호출은 여기서 하지 않는다 (PaymentCoordinator 가 트랜잭션 밖에서 한다).
 * 좌석/홀드는 직접 건드리지 않고 항상 HoldManager 를 거친다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentAttemptService {

    private final PaymentAttemptJpaRepository attemptRepository;
    private final ReconciliationCaseJpaRepository reconciliationRepository;
    private final HoldJpaRepository holdRepository;
    private final SeatJpaRepository seatRepository;
    private final BookingJpaRepository bookingRepository;
    private final HoldManager holdManager;
    private final ReservationLedger ledger;
    private final MeterRegistry meterRegistry;

    @Value("${ticketing.payment.currency:gbp}")
    private String currency;

    /**
     * 홀드당 pending 시도는 하나. 이미 있으면 그걸 돌려준다.
     * 새로 열 때 홀드를 한 번 연장해서 결제 중 만료될 틈을 줄인다.
     */
    @Transactional
    public OpenedAttempt open(Long holdId, String sessionToken) {
        LocalDateTime now = LocalDateTime.now();

        Hold hold = holdRepository.findByIdForUpdate(holdId)
                .filter(h -> h.isOwnedBy(sessionToken))
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLD_NOT_FOUND));

        Optional<PaymentAttempt> live = attemptRepository.findByHoldIdAndLive(holdId, 1);
        if (live.isPresent()) {
            PaymentAttempt existing = live.get();
            if (existing.getState() != PaymentAttemptState.PENDING) {
                throw new BusinessException(ErrorCode.HOLD_GONE, "이미 결제가 끝난 홀드입니다.");
            }
            return opened(existing, false, hold, false);
        }

        if (!hold.isLive(now)) {
            throw new BusinessException(ErrorCode.HOLD_GONE);
        }

        // 연장 한도를 다 썼으면 남은 시간으로 진행
        boolean renewed = holdManager.renew(holdId, sessionToken);

        long amount = totalPrice(hold.getSeatIds());
        PaymentAttempt attempt;
        try {
            attempt = attemptRepository.saveAndFlush(PaymentAttempt.pending(holdId, amount, currency, now));
        } catch (DataIntegrityViolationException e) {
            throw new BusinessException(ErrorCode.PAYMENT_IN_PROGRESS, e);
        }

        ledger.recordPayment(LedgerAction.PAYMENT_STARTED, holdId, hold.getShowId(), hold.getSeatIds(),
                attempt.getId(), "amountPence=" + amount + ", currency=" + currency);
        log.info("payment attempt opened. paymentAttemptId={}, holdId={}, amountPence={}",
                attempt.getId(), holdId, amount);
        return opened(attempt, true, hold, renewed);
    }

    @Transactional
    public PaymentAttempt attachIntent(Long attemptId, PaymentIntent intent) {
        PaymentAttempt attempt = lock(attemptId);
        if (attempt.getState() == PaymentAttemptState.PENDING && !attempt.hasIntent()) {
            attempt.attachIntent(intent, LocalDateTime.now());
        }
        return attempt;
    }

    /** 결제사 호출 자체가 실패한 경우. 홀드는 그대로 두고 다음 시도를 열 수 있게 한다. */
    @Transactional
    public void markProviderFailure(Long attemptId, String reason) {
        PaymentAttempt attempt = lock(attemptId);
        if (attempt.getState() != PaymentAttemptState.PENDING) {
            return;
        }
        attempt.markFailed(reason, LocalDateTime.now());
        ledger.recordPayment(LedgerAction.PAYMENT_FAILED, attempt.getHoldId(), showIdOf(attempt.getHoldId()),
                null, attemptId, "provider unavailable: " + reason);
    }

    @Transactional(readOnly = true)
    public Long findAttemptIdByProviderRef(String providerRef) {
        return attemptRepository.findByProviderRef(providerRef)
                .map(PaymentAttempt::getId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_ATTEMPT_NOT_FOUND));
    }

    /**
     * 결제사 결과 반영. 같은 결과가 여러 번 와도 처음 결과를 그대로 돌려준다.
     * 결제 성공인데 홀드를 확정하지 못하면 정산 대상으로 남기고 성공이라고 답하지 않는다.
     */
    @Transactional
    public PaymentConfirmation settle(Long attemptId, PaymentOutcome outcome) {
        LocalDateTime now = LocalDateTime.now();
        PaymentAttempt attempt = lock(attemptId);

        return switch (attempt.getState()) {
            case SUCCEEDED -> replaySucceeded(attempt, outcome);
            case FAILED -> outcome == PaymentOutcome.SUCCEEDED
                    ? succeededAfterFailure(attempt, now)
                    : PaymentConfirmation.failed(attemptId, attempt.getHoldId(), attempt.getFailReason());
            case PENDING -> outcome == PaymentOutcome.SUCCEEDED
                    ? promote(attempt, now)
                    : fail(attempt, now);
        };
    }

    private PaymentConfirmation promote(PaymentAttempt attempt, LocalDateTime now) {
        PromoteResult result = holdManager.promote(attempt.getHoldId(), attempt.getProviderRef(), null);

        if (result.outcome() == PromoteResult.Outcome.ALREADY_TERMINAL) {
            attempt.markSucceededNeedsReconciliation("hold " + result.holdState() + " before payment confirmed", now);
            openReconciliation(attempt, result.seatIds(), result, now);
            return PaymentConfirmation.reconciliationRequired(attempt.getId(), attempt.getHoldId());
        }

        Booking booking = result.booking();
        attempt.markSucceeded(booking.getId(), now);
        ledger.recordPayment(LedgerAction.PAYMENT_SUCCEEDED, attempt.getHoldId(), result.showId(),
                result.seatIds(), attempt.getId(), "bookingId=" + booking.getId());
        meterRegistry.counter("ticketing.payment.settled", "status", "confirmed").increment();
        return PaymentConfirmation.confirmed(attempt.getId(), attempt.getHoldId(), booking.getId(),
                booking.getTotalAmountPence());
    }

    private PaymentConfirmation fail(PaymentAttempt attempt, LocalDateTime now) {
        holdManager.releaseBySystem(attempt.getHoldId(), "payment failed. paymentAttemptId=" + attempt.getId());
        attempt.markFailed("payment failed", now);

        ledger.recordPayment(LedgerAction.PAYMENT_FAILED, attempt.getHoldId(), showIdOf(attempt.getHoldId()),
                null, attempt.getId(), "provider reported failure");
        meterRegistry.counter("ticketing.payment.settled", "status", "failed").increment();
        log.info("payment failed, hold released. paymentAttemptId={}, holdId={}", attempt.getId(), attempt.getHoldId());
        return PaymentConfirmation.failed(attempt.getId(), attempt.getHoldId(), "결제가 실패했습니다.");
    }

    private PaymentConfirmation replaySucceeded(PaymentAttempt attempt, PaymentOutcome outcome) {
        if (outcome == PaymentOutcome.FAILED) {
            log.warn("failure reported after success, ignored. paymentAttemptId={}", attempt.getId());
        }
        if (attempt.isReconciliationRequired()) {
            return PaymentConfirmation.reconciliationRequired(attempt.getId(), attempt.getHoldId());
        }
        Booking booking = bookingRepository.findById(attempt.getBookingId())
                .orElseThrow(() -> new IllegalStateException("succeeded attempt without booking. paymentAttemptId="
                        + attempt.getId()));
        return PaymentConfirmation.confirmed(attempt.getId(), attempt.getHoldId(), booking.getId(),
                booking.getTotalAmountPence());
    }

    // 포기한 시도에 뒤늦게 성공 통지가 온 경우. 홀드는 이미 풀렸을 수 있다.
    private PaymentConfirmation succeededAfterFailure(PaymentAttempt attempt, LocalDateTime now) {
        Hold hold = holdRepository.findById(attempt.getHoldId())
                .orElseThrow(() -> new IllegalStateException("attempt without hold. paymentAttemptId=" + attempt.getId()));
        attempt.markSucceededNeedsReconciliation("payment succeeded after attempt was failed", now);
        PromoteResult snapshot = new PromoteResult(PromoteResult.Outcome.ALREADY_TERMINAL, null, hold.getId(),
                hold.getShowId(), Set.copyOf(hold.getSeatIds()), hold.effectiveState(now), hold.getExpiresAt());
        openReconciliation(attempt, hold.getSeatIds(), snapshot, now);
        return PaymentConfirmation.reconciliationRequired(attempt.getId(), attempt.getHoldId());
    }

    private void openReconciliation(PaymentAttempt attempt, Collection<Long> seatIds, PromoteResult hold,
                                    LocalDateTime now) {
        String detail = "holdState=" + hold.holdState() + ", holdExpiresAt=" + hold.holdExpiresAt();
        if (!reconciliationRepository.existsByPaymentAttemptId(attempt.getId())) {
            reconciliationRepository.save(ReconciliationCase.open(attempt, seatIds, hold.holdState(),
                    hold.holdExpiresAt(), detail, now));
        }
        ledger.recordPayment(LedgerAction.RECONCILIATION_REQUIRED, attempt.getHoldId(), hold.showId(), seatIds,
                attempt.getId(), detail);
        meterRegistry.counter("ticketing.payment.reconciliation").increment();

        log.error("[RECONCILIATION_REQUIRED] payment succeeded but seats not confirmed. paymentAttemptId={}, holdId={}, "
                        + "providerRef={}, seatIds={}, amountPence={}, holdState={}, holdExpiresAt={}, confirmedAt={}",
                attempt.getId(), attempt.getHoldId(), attempt.getProviderRef(), seatIds, attempt.getAmountPence(),
                hold.holdState(), hold.holdExpiresAt(), now);
    }

    private long totalPrice(Collection<Long> seatIds) {
        List<Seat> seats = seatRepository.findAllById(seatIds);
        if (seats.size() != seatIds.size()) {
            throw new IllegalStateException("hold references missing seats. seatIds=" + seatIds);
        }
        return seats.stream().mapToLong(Seat::getPricePence).sum();
    }

    private Long showIdOf(Long holdId) {
        return holdRepository.findById(holdId).map(Hold::getShowId)
                .orElseThrow(() -> new IllegalStateException("attempt without hold. holdId=" + holdId));
    }

    private PaymentAttempt lock(Long attemptId) {
        return attemptRepository.findByIdForUpdate(attemptId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_ATTEMPT_NOT_FOUND));
    }

    private static OpenedAttempt opened(PaymentAttempt attempt, boolean created, Hold hold, boolean renewed) {
        return new OpenedAttempt(attempt, created, hold.getShowId(), Set.copyOf(hold.getSeatIds()),
                hold.getSessionToken(), hold.getExpiresAt(), renewed);
    }
}
