package com.lml.reservation.domain.payment;

import com.lml.reservation.domain.hold.HoldState;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 결제는 성공했는데 홀드가 이미 만료/해제되어 좌석을 확정하지 못한 건.
 * 수동 처리(환불 또는 좌석 재배정) 전까지 남겨둔다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "reconciliation_case",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_reconciliation_attempt", columnNames = {"payment_attempt_id"})
        }
)
public class ReconciliationCase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "payment_attempt_id", nullable = false)
    private Long paymentAttemptId;

    @Column(name = "hold_id", nullable = false)
    private Long holdId;

    @Column(name = "provider_ref", length = 120)
    private String providerRef;

    @Column(name = "seat_ids", nullable = false, length = 1000)
    private String seatIds;

    @Column(name = "amount_pence", nullable = false)
    private long amountPence;

    @Enumerated(EnumType.STRING)
    @Column(name = "hold_state", length = 20)
    private HoldState holdState;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Column(name = "payment_confirmed_at", nullable = false)
    private LocalDateTime paymentConfirmedAt;

    @Column(name = "detail", length = 500)
    private String detail;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    public static ReconciliationCase open(PaymentAttempt attempt, Collection<Long> seatIds,
                                          HoldState holdState, LocalDateTime holdExpiresAt,
                                          String detail, LocalDateTime now) {
        ReconciliationCase c = new ReconciliationCase();
        c.paymentAttemptId = attempt.getId();
        c.holdId = attempt.getHoldId();
        c.providerRef = attempt.getProviderRef();
        c.seatIds = seatIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        c.amountPence = attempt.getAmountPence();
        c.holdState = holdState;
        c.holdExpiresAt = holdExpiresAt;
        c.paymentConfirmedAt = now;
        c.detail = detail == null || detail.length() <= 500 ? detail : detail.substring(0, 500);
        c.resolved = false;
        return c;
    }
}
