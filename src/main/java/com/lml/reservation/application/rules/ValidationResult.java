package com.lml.reservation.application.rules;

import java.util.List;

/**
 * 선택 검증 결과. valid=false 여도 예외가 아니라 정상 결과다.
 * suggestedAlternatives 는 검증 시점에 AVAILABLE 이었던 좌석 묶음만 담는다.
 */
public record ValidationResult(
        boolean valid,
        RejectReason reason,
        String message,
        List<String> warnings,
        List<List<Long>> suggestedAlternatives
) {

    public ValidationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        suggestedAlternatives = suggestedAlternatives == null ? List.of() : List.copyOf(suggestedAlternatives);
    }

    public static ValidationResult ok(List<String> warnings) {
        return new ValidationResult(true, null, null, warnings, List.of());
    }

    public static ValidationResult rejected(RejectReason reason, String message) {
        return new ValidationResult(false, reason, message, List.of(), List.of());
    }

    public ValidationResult withAlternatives(List<List<Long>> alternatives) {
        return new ValidationResult(valid, reason, message, warnings, alternatives);
    }

    public ValidationResult withWarnings(List<String> more) {
        return new ValidationResult(valid, reason, message, more, suggestedAlternatives);
    }
}
