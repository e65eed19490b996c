package com.lml.reservation.api.payment.dto;

import com.lml.reservation.application.payment.PaymentConfirmation;

public record PaymentWebhookResponse(
        PaymentConfirmation.Status status,
        Long paymentAttemptId,
        Long bookingId,
        Long totalAmountPence,
        String message
) {
    public static PaymentWebhookResponse from(PaymentConfirmation c) {
        return new PaymentWebhookResponse(c.status(), c.paymentAttemptId(), c.bookingId(),
                c.totalAmountPence(), c.message());
    }
}
