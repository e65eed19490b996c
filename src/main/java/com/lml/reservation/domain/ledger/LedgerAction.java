package com.lml.reservation.domain.ledger;

public enum LedgerAction {
    HOLD_GRANTED,
    HOLD_CONFLICT,
    HOLD_RENEWED,
    HOLD_RELEASED,
    HOLD_EXPIRED,
    HOLD_PROMOTED,
    PAYMENT_STARTED,
    PAYMENT_SUCCEEDED,
    PAYMENT_FAILED,
    RECONCILIATION_REQUIRED
}
