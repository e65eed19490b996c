package com.lml.reservation.application.seat;

import com.lml.reservation.domain.seat.SeatStatus;

/**
 * 좌석 조회용 스냅샷. status 는 읽는 시점 기준 유효 상태.
 */
public record SeatSnapshot(
        Long seatId,
        Long showId,
        String sectionId,
        String row,
        int number,
        int pricePence,
        boolean accessible,
        SeatStatus status
) {

    public boolean isAvailable() {
        return status == SeatStatus.AVAILABLE;
    }

    public String label() {
        return sectionId + ":" + row + number;
    }
}
