package com.lml.reservation.api.payment.dto;

import com.lml.reservation.domain.payment.PaymentOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record PaymentWebhookRequest(
        @NotBlank String providerRef,
        @NotNull PaymentOutcome outcome
) {}
