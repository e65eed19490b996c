package com.lml.reservation.application.notify;

import com.lml.reservation.domain.seat.SeatStatus;

import java.time.LocalDateTime;

public record SeatStatusChanged(
        Long showId,
        Long seatId,
        SeatStatus newStatus,
        Long holdId,              // HELD 일 때만
        LocalDateTime occurredAt
) {}
