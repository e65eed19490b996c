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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class PaymentAttemptServiceTest {

    private static final Long HOLD_ID = 10L;
    private static final Long ATTEMPT_ID = 500L;
    private static final String TOKEN = "sess-1";

    private final PaymentAttemptJpaRepository attemptRepository = mock(PaymentAttemptJpaRepository.class);
    private final ReconciliationCaseJpaRepository reconciliationRepository = mock(ReconciliationCaseJpaRepository.class);
    private final HoldJpaRepository holdRepository = mock(HoldJpaRepository.class);
    private final SeatJpaRepository seatRepository = mock(SeatJpaRepository.class);
    private final BookingJpaRepository bookingRepository = mock(BookingJpaRepository.class);
    private final HoldManager holdManager = mock(HoldManager.class);
    private final ReservationLedger ledger = mock(ReservationLedger.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private PaymentAttemptService service;
    private Hold hold;

    @BeforeEach
    void setUp() {
        service = new PaymentAttemptService(attemptRepository, reconciliationRepository, holdRepository,
                seatRepository, bookingRepository, holdManager, ledger, meterRegistry);
        ReflectionTestUtils.setField(service, "currency", "gbp");

        hold = Hold.newHold(1L, Set.of(1L, 2L), TOKEN, "u-1", LocalDateTime.now(), Duration.ofSeconds(900));
        ReflectionTestUtils.setField(hold, "id", HOLD_ID);
        given(holdRepository.findByIdForUpdate(HOLD_ID)).willReturn(Optional.of(hold));
        given(holdRepository.findById(HOLD_ID)).willReturn(Optional.of(hold));
    }

    private static PaymentAttempt attempt(PaymentAttemptState state) {
        PaymentAttempt a = PaymentAttempt.pending(HOLD_ID, 7000, "gbp", LocalDateTime.now());
        ReflectionTestUtils.setField(a, "id", ATTEMPT_ID);
        a.attachIntent(new PaymentIntent("pi_1", "pi_1_secret_x"), LocalDateTime.now());
        if (state == PaymentAttemptState.FAILED) {
            a.markFailed("payment failed", LocalDateTime.now());
        }
        return a;
    }

    private static Booking booking() {
        Booking b = Booking.fromHold(HOLD_ID, 1L, Set.of(1L, 2L), "u-1", null, 7000, "pi_1", LocalDateTime.now());
        ReflectionTestUtils.setField(b, "id", 77L);
        return b;
    }

    private static Seat seat(long id, int price) {
        Seat s = Seat.create(1L, "STALLS", "A", (int) id, price, false);
        ReflectionTestUtils.setField(s, "id", id);
        return s;
    }

    @Test
    @DisplayName("open: 새 시도를 만들고 금액은 좌석 가격 합으로 다시 계산한다")
    void open_createsAttemptWithServerSideAmount() {
        given(attemptRepository.findByHoldIdAndLive(HOLD_ID, 1)).willReturn(Optional.empty());
        given(holdManager.renew(HOLD_ID, TOKEN)).willReturn(true);
        given(seatRepository.findAllById(Set.of(1L, 2L))).willReturn(List.of(seat(1, 4000), seat(2, 3000)));
        given(attemptRepository.saveAndFlush(any(PaymentAttempt.class))).willAnswer(inv -> {
            PaymentAttempt a = inv.getArgument(0);
            ReflectionTestUtils.setField(a, "id", ATTEMPT_ID);
            return a;
        });

        OpenedAttempt opened = service.open(HOLD_ID, TOKEN);

        assertThat(opened.created()).isTrue();
        assertThat(opened.renewed()).isTrue();
        assertThat(opened.attempt().getAmountPence()).isEqualTo(7000);
        assertThat(opened.attempt().getCurrency()).isEqualTo("gbp");
        verify(ledger).recordPayment(eq(LedgerAction.PAYMENT_STARTED), eq(HOLD_ID), eq(1L), any(),
                eq(ATTEMPT_ID), anyString());
    }

    @Test
    @DisplayName("open: pending 시도가 이미 있으면 그대로 돌려준다")
    void open_reusesPendingAttempt() {
        PaymentAttempt existing = attempt(PaymentAttemptState.PENDING);
        given(attemptRepository.findByHoldIdAndLive(HOLD_ID, 1)).willReturn(Optional.of(existing));

        OpenedAttempt opened = service.open(HOLD_ID, TOKEN);

        assertThat(opened.created()).isFalse();
        assertThat(opened.attempt()).isSameAs(existing);
        verify(attemptRepository, never()).saveAndFlush(any());
        verify(holdManager, never()).renew(anyLong(), anyString());
    }

    @Test
    @DisplayName("open: 다른 세션의 홀드는 HOLD_NOT_FOUND")
    void open_foreignSession() {
        assertThatThrownBy(() -> service.open(HOLD_ID, "someone-else"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.HOLD_NOT_FOUND);
    }

    @Test
    @DisplayName("open: 만료된 홀드는 HOLD_GONE")
    void open_expiredHold() {
        ReflectionTestUtils.setField(hold, "expiresAt", LocalDateTime.now().minusSeconds(1));
        given(attemptRepository.findByHoldIdAndLive(HOLD_ID, 1)).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.open(HOLD_ID, TOKEN))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.HOLD_GONE);
    }

    @Test
    @DisplayName("open: 동시 요청이 먼저 시도를 만들었으면 PAYMENT_IN_PROGRESS")
    void open_uniqueLiveAttemptViolation() {
        given(attemptRepository.findByHoldIdAndLive(HOLD_ID, 1)).willReturn(Optional.empty());
        given(seatRepository.findAllById(Set.of(1L, 2L))).willReturn(List.of(seat(1, 4000), seat(2, 3000)));
        given(attemptRepository.saveAndFlush(any(PaymentAttempt.class)))
                .willThrow(new DataIntegrityViolationException("ux_payment_attempt_live"));

        assertThatThrownBy(() -> service.open(HOLD_ID, TOKEN))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.PAYMENT_IN_PROGRESS);
    }

    @Test
    @DisplayName("settle: 성공 통지면 홀드를 예매로 승격")
    void settle_success_promotes() {
        PaymentAttempt attempt = attempt(PaymentAttemptState.PENDING);
        given(attemptRepository.findByIdForUpdate(ATTEMPT_ID)).willReturn(Optional.of(attempt));
        given(holdManager.promote(HOLD_ID, "pi_1", null)).willReturn(PromoteResult.promoted(booking(), hold));

        PaymentConfirmation confirmation = service.settle(ATTEMPT_ID, PaymentOutcome.SUCCEEDED);

        assertThat(confirmation.status()).isEqualTo(PaymentConfirmation.Status.CONFIRMED);
        assertThat(confirmation.bookingId()).isEqualTo(77L);
        assertThat(confirmation.totalAmountPence()).isEqualTo(7000L);
        assertThat(attempt.getState()).isEqualTo(PaymentAttemptState.SUCCEEDED);
        assertThat(attempt.getBookingId()).isEqualTo(77L);
    }

    @Test
    @DisplayName("settle: 결제는 성공했는데 홀드가 이미 만료됐으면 정산 대상")
    void settle_successAfterExpiry_requiresReconciliation() {
        PaymentAttempt attempt = attempt(PaymentAttemptState.PENDING);
        given(attemptRepository.findByIdForUpdate(ATTEMPT_ID)).willReturn(Optional.of(attempt));
        hold.expire(LocalDateTime.now());
        given(holdManager.promote(HOLD_ID, "pi_1", null)).willReturn(PromoteResult.alreadyTerminal(hold));
        given(reconciliationRepository.existsByPaymentAttemptId(ATTEMPT_ID)).willReturn(false);

        PaymentConfirmation confirmation = service.settle(ATTEMPT_ID, PaymentOutcome.SUCCEEDED);

        assertThat(confirmation.status()).isEqualTo(PaymentConfirmation.Status.RECONCILIATION_REQUIRED);
        assertThat(confirmation.bookingId()).isNull();
        assertThat(attempt.isReconciliationRequired()).isTrue();
        verify(reconciliationRepository).save(any(ReconciliationCase.class));
        verify(ledger).recordPayment(eq(LedgerAction.RECONCILIATION_REQUIRED), eq(HOLD_ID), eq(1L), any(),
                eq(ATTEMPT_ID), anyString());
        assertThat(meterRegistry.counter("ticketing.payment.reconciliation").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("settle: 같은 성공 통지가 다시 오면 처음 결과를 그대로 돌려준다")
    void settle_replay_isIdempotent() {
        PaymentAttempt attempt = attempt(PaymentAttemptState.PENDING);
        attempt.markSucceeded(77L, LocalDateTime.now());
        given(attemptRepository.findByIdForUpdate(ATTEMPT_ID)).willReturn(Optional.of(attempt));
        given(bookingRepository.findById(77L)).willReturn(Optional.of(booking()));

        PaymentConfirmation confirmation = service.settle(ATTEMPT_ID, PaymentOutcome.SUCCEEDED);

        assertThat(confirmation.status()).isEqualTo(PaymentConfirmation.Status.CONFIRMED);
        assertThat(confirmation.bookingId()).isEqualTo(77L);
        verify(holdManager, never()).promote(any(), any(), any());
    }

    @Test
    @DisplayName("settle: 실패 통지면 홀드를 풀고 시도를 실패 처리")
    void settle_failure_releasesHold() {
        PaymentAttempt attempt = attempt(PaymentAttemptState.PENDING);
        given(attemptRepository.findByIdForUpdate(ATTEMPT_ID)).willReturn(Optional.of(attempt));

        PaymentConfirmation confirmation = service.settle(ATTEMPT_ID, PaymentOutcome.FAILED);

        assertThat(confirmation.status()).isEqualTo(PaymentConfirmation.Status.FAILED);
        assertThat(attempt.getState()).isEqualTo(PaymentAttemptState.FAILED);
        assertThat(attempt.getLive()).isNull();
        verify(holdManager).releaseBySystem(eq(HOLD_ID), anyString());
    }

    @Test
    @DisplayName("settle: 실패 처리된 시도에 뒤늦은 성공 통지는 정산 대상")
    void settle_successAfterFailure_requiresReconciliation() {
        PaymentAttempt attempt = attempt(PaymentAttemptState.FAILED);
        given(attemptRepository.findByIdForUpdate(ATTEMPT_ID)).willReturn(Optional.of(attempt));

        PaymentConfirmation confirmation = service.settle(ATTEMPT_ID, PaymentOutcome.SUCCEEDED);

        assertThat(confirmation.status()).isEqualTo(PaymentConfirmation.Status.RECONCILIATION_REQUIRED);
        verify(holdManager, never()).promote(any(), any(), any());
        verify(reconciliationRepository).save(any(ReconciliationCase.class));
    }

    @Test
    void settle_unknownAttempt() {
        given(attemptRepository.findByIdForUpdate(999L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.settle(999L, PaymentOutcome.SUCCEEDED))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.PAYMENT_ATTEMPT_NOT_FOUND);
        verify(holdManager, never()).promote(any(), any(), any());
    }
}
