package com.lml.reservation.domain.payment;

public enum PaymentAttemptState {
    PENDING,    // 결제 진행 중
    SUCCEEDED,  // 결제사 성공 통보
    FAILED      // 결제 실패/취소, 결제사 연결 실패
}
