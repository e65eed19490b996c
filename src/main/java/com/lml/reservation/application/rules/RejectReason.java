package com.lml.reservation.application.rules;

public enum RejectReason {
    EMPTY_SELECTION,
    UNKNOWN_SEAT,
    TOO_MANY_SEATS,
    SEAT_UNAVAILABLE,
    SECTION_RESTRICTED
}
