package com.lml.reservation.application.payment;

import com.lml.reservation.application.hold.HoldManager;
import com.lml.reservation.common.exception.BusinessException;
import com.lml.reservation.common.exception.ErrorCode;
import com.lml.reservation.common.retry.TransientRetry;
import com.lml.reservation.domain.hold.SeatLockStore;
import com.lml.reservation.domain.payment.PaymentAttempt;
import com.lml.reservation.domain.payment.PaymentIntent;
import com.lml.reservation.domain.payment.PaymentOutcome;
import com.lml.reservation.domain.payment.PaymentProviderClient;
import com.lml.reservation.domain.payment.PaymentProviderException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 홀드 -> 결제 -> 확정/해제 연결.
 *
 * 트랜잭션을 잡지 않는다. 결제사 왕복 동안 좌석/홀드 row 락을 쥐고 있으면 안 되기 때문에
 * DB 작업은 PaymentAttemptService 의 짧은 트랜잭션들로 나누고, 그 사이에 결제사를 기다린다.
 */
@Slf4j
@Service
public class PaymentCoordinator {

    private final PaymentAttemptService attemptService;
    private final PaymentProviderClient provider;
    private final HoldManager holdManager;
    private final SeatLockStore seatLockStore;
    private final TransientRetry retry;
    private final MeterRegistry meterRegistry;
    private final long providerTimeoutMs;

    public PaymentCoordinator(PaymentAttemptService attemptService,
                              PaymentProviderClient provider,
                              HoldManager holdManager,
                              SeatLockStore seatLockStore,
                              TransientRetry retry,
                              MeterRegistry meterRegistry,
                              @Value("${ticketing.payment.provider-timeout-ms:5000}") long providerTimeoutMs) {
        this.attemptService = attemptService;
        this.provider = provider;
        this.holdManager = holdManager;
        this.seatLockStore = seatLockStore;
        this.retry = retry;
        this.meterRegistry = meterRegistry;
        this.providerTimeoutMs = providerTimeoutMs;
    }

    /**
     * pending 시도를 열고(또는 재사용) 결제사 client secret 을 받아온다.
     * 금액은 서버에서 좌석 가격 합으로 다시 계산한다.
     */
    public PaymentStart beginPayment(Long holdId, String sessionToken) {
        OpenedAttempt opened = inTransaction("payment.open", () -> attemptService.open(holdId, sessionToken));
        if (opened.renewed()) {
            long remaining = Math.max(1, Duration.between(LocalDateTime.now(), opened.holdExpiresAt()).getSeconds());
            seatLockStore.extendSeats(opened.showId(), opened.seatIds(), opened.sessionToken(), remaining);
        }

        PaymentAttempt attempt = opened.attempt();
        if (attempt.hasIntent()) {
            return PaymentStart.of(attempt, opened.holdExpiresAt());
        }
        if (!opened.created()) {
            // 다른 요청이 intent 를 받아오는 중
            throw new BusinessException(ErrorCode.PAYMENT_IN_PROGRESS);
        }

        PaymentIntent intent;
        try {
            intent = retry.call("payment.createIntent", () -> requestIntent(attempt, opened),
                    e -> e instanceof PaymentProviderException p && p.isRetryable());
        } catch (PaymentProviderException e) {
            log.warn("payment provider unavailable. paymentAttemptId={}, holdId={}, err={}",
                    attempt.getId(), holdId, e.getMessage());
            meterRegistry.counter("ticketing.payment.provider.failures").increment();
            inTransaction("payment.markProviderFailure", () -> {
                attemptService.markProviderFailure(attempt.getId(), e.getMessage());
                return null;
            });
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_UNAVAILABLE, e);
        }

        PaymentAttempt attached = inTransaction("payment.attachIntent",
                () -> attemptService.attachIntent(attempt.getId(), intent));
        return PaymentStart.of(attached, opened.holdExpiresAt());
    }

    public PaymentConfirmation confirmPayment(Long paymentAttemptId, PaymentOutcome outcome) {
        if (paymentAttemptId == null || outcome == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }

        PaymentConfirmation confirmation = inTransaction("payment.settle",
                () -> attemptService.settle(paymentAttemptId, outcome));

        if (confirmation.status() != PaymentConfirmation.Status.RECONCILIATION_REQUIRED) {
            // 확정/해제 모두 좌석 캐시 키는 더 필요 없다
            holdManager.getHold(confirmation.holdId()).ifPresent(h ->
                    seatLockStore.releaseSeats(h.getShowId(), h.getSeatIds(), h.getSessionToken()));
        }

        log.info("payment settled. paymentAttemptId={}, outcome={}, status={}, bookingId={}",
                paymentAttemptId, outcome, confirmation.status(), confirmation.bookingId());
        return confirmation;
    }

    public PaymentConfirmation handleWebhook(String providerRef, PaymentOutcome outcome) {
        if (providerRef == null || providerRef.isBlank() || outcome == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }
        Long attemptId = attemptService.findAttemptIdByProviderRef(providerRef);
        return confirmPayment(attemptId, outcome);
    }

    private PaymentIntent requestIntent(PaymentAttempt attempt, OpenedAttempt opened) {
        Map<String, String> metadata = Map.of(
                "holdId", String.valueOf(attempt.getHoldId()),
                "paymentAttemptId", String.valueOf(attempt.getId()),
                "showId", String.valueOf(opened.showId()),
                "seatIds", opened.seatIds().toString());
        try {
            return provider.createPaymentIntent(attempt.getAmountPence(), attempt.getCurrency(),
                            "attempt-" + attempt.getId(), metadata)
                    .get(providerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new PaymentProviderException("payment provider timed out after " + providerTimeoutMs + "ms", true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PaymentProviderException p) {
                throw p;
            }
            throw new PaymentProviderException("payment provider call failed: " + cause, true, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PaymentProviderException("interrupted while waiting for payment provider", false, e);
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> action) {
        try {
            return retry.call(operation, action);
        } catch (RuntimeException e) {
            if (TransientRetry.isTransient(e)) {
                throw new BusinessException(ErrorCode.TRY_AGAIN, e);
            }
            throw e;
        }
    }
}
