package com.lml.reservation.application.hold;

import com.lml.reservation.application.rules.ValidationResult;
import com.lml.reservation.domain.hold.Hold;

import java.util.Set;
import java.util.TreeSet;

/**
 * tryHold 결과. 충돌과 검증 실패는 예외가 아니라 여기로 돌려준다.
 */
public record HoldResult(
        Outcome outcome,
        Hold hold,
        Set<Long> conflictSeatIds,
        ValidationResult validation
) {

    public enum Outcome {
        GRANTED,
        CONFLICT,
        INVALID
    }

    public static HoldResult granted(Hold hold) {
        return new HoldResult(Outcome.GRANTED, hold, Set.of(), null);
    }

    public static HoldResult conflict(Set<Long> conflictSeatIds) {
        return new HoldResult(Outcome.CONFLICT, null, new TreeSet<>(conflictSeatIds), null);
    }

    public static HoldResult invalid(ValidationResult validation) {
        return new HoldResult(Outcome.INVALID, null, Set.of(), validation);
    }

    public HoldResult withValidation(ValidationResult validation) {
        return new HoldResult(outcome, hold, conflictSeatIds, validation);
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }
}
