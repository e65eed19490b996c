package com.lml.reservation.domain.payment;

public enum PaymentOutcome {
    SUCCEEDED,
    FAILED
}
