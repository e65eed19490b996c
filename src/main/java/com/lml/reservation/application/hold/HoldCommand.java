package com.lml.reservation.application.hold;

import com.lml.reservation.application.rules.SelectionConstraints;

import java.util.List;

/**
 * 홀드 요청. seatIds 또는 seatCodes 중 하나로 좌석을 지정한다.
 */
public record HoldCommand(
        Long showId,
        List<Long> seatIds,
        List<String> seatCodes,
        String sessionToken,
        String userId,
        Long ttlSeconds,
        SelectionConstraints constraints
) {}
