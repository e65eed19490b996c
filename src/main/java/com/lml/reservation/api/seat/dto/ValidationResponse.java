package com.lml.reservation.api.seat.dto;

import com.lml.reservation.application.rules.ValidationResult;

import java.util.List;

public record ValidationResponse(
        boolean valid,
        String reason,
        String message,
        List<String> warnings,
        List<List<Long>> suggestedAlternatives
) {
    public static ValidationResponse from(ValidationResult r) {
        return new ValidationResponse(r.valid(), r.reason() == null ? null : r.reason().name(), r.message(),
                r.warnings(), r.suggestedAlternatives());
    }
}
