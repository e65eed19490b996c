package com.lml.reservation.api.hold.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.Set;

public record HoldRequest(
        @NotNull(message = "showId는 필수입니다.")
        Long showId,

        List<Long> seatIds,

        List<String> seatCodes,  // 레이아웃 좌석 코드 (seat_alias)

        @NotBlank(message = "sessionToken은 필수입니다.")
        String sessionToken,

        String userId,           // 게스트면 null

        @Positive
        Long ttlSeconds,

        Integer customerAge,

        Set<String> allowedSectionIds
) {
    @AssertTrue(message = "seatIds 또는 seatCodes 중 하나는 필수입니다.")
    public boolean isSeatSelected() {
        return (seatIds != null && !seatIds.isEmpty()) || (seatCodes != null && !seatCodes.isEmpty());
    }
}
