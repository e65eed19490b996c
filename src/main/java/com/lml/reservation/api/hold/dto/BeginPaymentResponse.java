package com.lml.reservation.api.hold.dto;

import com.lml.reservation.application.payment.PaymentStart;

import java.time.LocalDateTime;

public record BeginPaymentResponse(
        Long paymentAttemptId,
        String clientSecret,
        long amountPence,
        String currency,
        LocalDateTime holdExpiresAt
) {
    public static BeginPaymentResponse from(PaymentStart start) {
        return new BeginPaymentResponse(start.paymentAttemptId(), start.clientSecret(), start.amountPence(),
                start.currency(), start.holdExpiresAt());
    }
}
