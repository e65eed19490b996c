package com.lml.reservation.api.hold.dto;

import com.lml.reservation.domain.ledger.LedgerAction;
import com.lml.reservation.domain.ledger.LedgerEntry;

import java.time.LocalDateTime;

public record LedgerEntryResponse(
        Long id,
        LedgerAction action,
        String seatIds,
        Long paymentAttemptId,
        String detail,
        LocalDateTime createdAt
) {
    public static LedgerEntryResponse from(LedgerEntry e) {
        return new LedgerEntryResponse(e.getId(), e.getAction(), e.getSeatIds(), e.getPaymentAttemptId(),
                e.getDetail(), e.getCreatedAt());
    }
}
