package com.lml.reservation.application.hold;

import com.lml.reservation.domain.hold.Hold;
import com.lml.reservation.domain.hold.HoldState;

import java.time.LocalDateTime;
import java.util.List;

// state 는 읽는 시점 기준 (만료된 ACTIVE -> EXPIRED)
public record HoldView(
        Long holdId,
        Long showId,
        List<Long> seatIds,
        HoldState state,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        int renewCount
) {

    public static HoldView of(Hold hold, LocalDateTime now) {
        return new HoldView(hold.getId(), hold.getShowId(), hold.getSeatIds().stream().sorted().toList(),
                hold.effectiveState(now), hold.getCreatedAt(), hold.getExpiresAt(), hold.getRenewCount());
    }
}
