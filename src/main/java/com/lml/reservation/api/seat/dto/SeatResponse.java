package com.lml.reservation.api.seat.dto;

import com.lml.reservation.application.seat.SeatSnapshot;
import com.lml.reservation.domain.seat.SeatStatus;

public record SeatResponse(
        Long seatId,
        String sectionId,
        String row,
        int number,
        int pricePence,
        boolean accessible,
        SeatStatus status
) {
    public static SeatResponse from(SeatSnapshot s) {
        return new SeatResponse(s.seatId(), s.sectionId(), s.row(), s.number(), s.pricePence(),
                s.accessible(), s.status());
    }
}
