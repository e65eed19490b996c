package com.lml.reservation.application.payment;

import com.lml.reservation.domain.payment.PaymentAttempt;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * 결제 시작 트랜잭션 결과.
 *
 * @param created false 면 이미 있던 pending 시도를 돌려준 것
 * @param renewed 이번에 홀드 만료 시각을 연장했는지
 */
public record OpenedAttempt(
        PaymentAttempt attempt,
        boolean created,
        Long showId,
        Set<Long> seatIds,
        String sessionToken,
        LocalDateTime holdExpiresAt,
        boolean renewed
) {}
