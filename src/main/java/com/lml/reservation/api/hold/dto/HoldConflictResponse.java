package com.lml.reservation.api.hold.dto;

import java.util.List;

public record HoldConflictResponse(
        String code,
        String message,
        List<Long> conflictSeatIds
) {
    public static HoldConflictResponse of(List<Long> conflictSeatIds) {
        return new HoldConflictResponse("SEAT_CONFLICT", "다른 고객이 먼저 선택한 좌석이 있습니다.", conflictSeatIds);
    }
}
