package com.lml.reservation.domain.seat;

public enum SeatStatus {
    AVAILABLE,
    HELD,
    SOLD
}
