package com.lml.reservation.application.payment;

/**
 * 결제 결과 반영 결과. RECONCILIATION_REQUIRED 는 절대 성공으로 안내하면 안 된다.
 */
public record PaymentConfirmation(
        Status status,
        Long paymentAttemptId,
        Long holdId,
        Long bookingId,
        Long totalAmountPence,
        String message
) {

    public enum Status {
        CONFIRMED,
        FAILED,
        RECONCILIATION_REQUIRED
    }

    public static PaymentConfirmation confirmed(Long attemptId, Long holdId, Long bookingId, long total) {
        return new PaymentConfirmation(Status.CONFIRMED, attemptId, holdId, bookingId, total, "예매가 확정되었습니다.");
    }

    public static PaymentConfirmation failed(Long attemptId, Long holdId, String message) {
        return new PaymentConfirmation(Status.FAILED, attemptId, holdId, null, null, message);
    }

    public static PaymentConfirmation reconciliationRequired(Long attemptId, Long holdId) {
        return new PaymentConfirmation(Status.RECONCILIATION_REQUIRED, attemptId, holdId, null, null,
                "결제는 접수되었지만 좌석을 확정하지 못했습니다. 고객센터에서 확인 후 안내드립니다.");
    }
}
