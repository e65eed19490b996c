package com.lml.reservation.api.hold.dto;

import com.lml.reservation.application.hold.HoldView;
import com.lml.reservation.domain.hold.HoldState;

import java.time.LocalDateTime;
import java.util.List;

public record HoldResponse(
        Long holdId,
        Long showId,
        List<Long> seatIds,
        HoldState state,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        int renewCount,
        List<String> warnings
) {
    public static HoldResponse of(HoldView view, List<String> warnings) {
        return new HoldResponse(view.holdId(), view.showId(), view.seatIds(), view.state(),
                view.createdAt(), view.expiresAt(), view.renewCount(), warnings == null ? List.of() : warnings);
    }
}
