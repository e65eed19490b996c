package com.lml.reservation.api.seat.dto;

import com.lml.reservation.application.seat.SeatSnapshot;

import java.util.List;

public record RecommendationResponse(
        List<Long> seatIds,
        String sectionId,
        String row,
        long totalPricePence
) {
    public static RecommendationResponse from(List<SeatSnapshot> block) {
        SeatSnapshot first = block.get(0);
        return new RecommendationResponse(
                block.stream().map(SeatSnapshot::seatId).toList(),
                first.sectionId(),
                first.row(),
                block.stream().mapToLong(SeatSnapshot::pricePence).sum());
    }
}
