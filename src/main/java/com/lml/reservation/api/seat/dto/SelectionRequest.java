package com.lml.reservation.api.seat.dto;

import jakarta.validation.constraints.AssertTrue;

import java.util.List;
import java.util.Set;

public record SelectionRequest(
        List<Long> seatIds,
        List<String> seatCodes,
        Integer customerAge,
        Set<String> allowedSectionIds
) {
    @AssertTrue(message = "seatIds 또는 seatCodes 중 하나는 필수입니다.")
    public boolean isSeatSelected() {
        return (seatIds != null && !seatIds.isEmpty()) || (seatCodes != null && !seatCodes.isEmpty());
    }
}
