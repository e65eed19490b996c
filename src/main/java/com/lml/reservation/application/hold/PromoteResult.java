package com.lml.reservation.application.hold;

import com.lml.reservation.domain.booking.Booking;
import com.lml.reservation.domain.hold.Hold;
import com.lml.reservation.domain.hold.HoldState;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * promote 결과.
 * ALREADY_TERMINAL 은 결제 쪽에서 수동 정산 대상으로 다뤄야 한다.
 */
public record PromoteResult(
        Outcome outcome,
        Booking booking,
        Long holdId,
        Long showId,
        Set<Long> seatIds,
        HoldState holdState,
        LocalDateTime holdExpiresAt
) {

    public enum Outcome {
        PROMOTED,
        ALREADY_PROMOTED,
        ALREADY_TERMINAL
    }

    public static PromoteResult promoted(Booking booking, Hold hold) {
        return of(Outcome.PROMOTED, booking, hold);
    }

    public static PromoteResult alreadyPromoted(Booking booking, Hold hold) {
        return of(Outcome.ALREADY_PROMOTED, booking, hold);
    }

    public static PromoteResult alreadyTerminal(Hold hold) {
        return of(Outcome.ALREADY_TERMINAL, null, hold);
    }

    private static PromoteResult of(Outcome outcome, Booking booking, Hold hold) {
        return new PromoteResult(outcome, booking, hold.getId(), hold.getShowId(),
                Set.copyOf(hold.getSeatIds()), hold.getState(), hold.getExpiresAt());
    }

    public boolean hasBooking() {
        return booking != null;
    }
}
