package com.lml.reservation.domain.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "payment_attempt",
        uniqueConstraints = {
                // live=1 인 시도는 홀드당 하나. 실패하면 live=NULL 로 풀어준다.
                @UniqueConstraint(name = "ux_payment_attempt_live", columnNames = {"hold_id", "live"}),
                @UniqueConstraint(name = "uk_payment_attempt_provider_ref", columnNames = {"provider_ref"})
        }
)
public class PaymentAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hold_id", nullable = false)
    private Long holdId;

    @Column(name = "provider_ref", length = 120)
    private String providerRef;

    @Column(name = "client_secret", length = 200)
    private String clientSecret;

    @Column(name = "amount_pence", nullable = false)
    private long amountPence;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private PaymentAttemptState state;

    @Column(name = "live")
    private Integer live; // 1=PENDING/SUCCEEDED, NULL=FAILED

    @Column(name = "booking_id")
    private Long bookingId;

    @Column(name = "reconciliation_required", nullable = false)
    private boolean reconciliationRequired;

    @Column(name = "fail_reason", length = 255)
    private String failReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static PaymentAttempt pending(Long holdId, long amountPence, String currency, LocalDateTime now) {
        PaymentAttempt a = new PaymentAttempt();
        a.holdId = holdId;
        a.amountPence = amountPence;
        a.currency = currency;
        a.state = PaymentAttemptState.PENDING;
        a.live = 1;
        a.createdAt = now;
        a.updatedAt = now;
        return a;
    }

    public void attachIntent(PaymentIntent intent, LocalDateTime now) {
        this.providerRef = intent.providerRef();
        this.clientSecret = intent.clientSecret();
        this.updatedAt = now;
    }

    public boolean hasIntent() {
        return providerRef != null;
    }

    public void markSucceeded(Long bookingId, LocalDateTime now) {
        this.state = PaymentAttemptState.SUCCEEDED;
        this.bookingId = bookingId;
        this.updatedAt = now;
    }

    /** 돈은 받았는데 좌석을 확정하지 못한 경우. */
    public void markSucceededNeedsReconciliation(String reason, LocalDateTime now) {
        this.state = PaymentAttemptState.SUCCEEDED;
        this.reconciliationRequired = true;
        this.failReason = trim255(reason);
        this.updatedAt = now;
    }

    public void markFailed(String reason, LocalDateTime now) {
        this.state = PaymentAttemptState.FAILED;
        this.live = null;
        this.failReason = trim255(reason);
        this.updatedAt = now;
    }

    public boolean isTerminal() {
        return state != PaymentAttemptState.PENDING;
    }

    private static String trim255(String s) {
        if (s == null) return null;
        return s.length() <= 255 ? s : s.substring(0, 255);
    }
}
