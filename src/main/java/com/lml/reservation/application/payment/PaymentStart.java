package com.lml.reservation.application.payment;

import com.lml.reservation.domain.payment.PaymentAttempt;

import java.time.LocalDateTime;

public record PaymentStart(
        Long paymentAttemptId,
        Long holdId,
        String providerRef,
        String clientSecret,
        long amountPence,
        String currency,
        LocalDateTime holdExpiresAt
) {

    public static PaymentStart of(PaymentAttempt attempt, LocalDateTime holdExpiresAt) {
        return new PaymentStart(attempt.getId(), attempt.getHoldId(), attempt.getProviderRef(),
                attempt.getClientSecret(), attempt.getAmountPence(), attempt.getCurrency(), holdExpiresAt);
    }
}
