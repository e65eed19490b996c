package com.lml.reservation.domain.payment;

public record PaymentIntent(
        String providerRef,
        String clientSecret
) {}
