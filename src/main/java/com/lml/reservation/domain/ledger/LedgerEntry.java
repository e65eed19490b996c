package com.lml.reservation.domain.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 홀드/결제 시도와 그 결과의 감사 기록. insert 만 한다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "reservation_ledger",
        indexes = {
                @Index(name = "ix_ledger_hold", columnList = "hold_id")
        }
)
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 40)
    private LedgerAction action;

    @Column(name = "hold_id")
    private Long holdId;

    @Column(name = "show_id", nullable = false)
    private Long showId;

    @Column(name = "seat_ids", length = 1000)
    private String seatIds;

    @Column(name = "session_token", length = 120)
    private String sessionToken;

    @Column(name = "payment_attempt_id")
    private Long paymentAttemptId;

    @Column(name = "detail", length = 500)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static LedgerEntry of(LedgerAction action, Long holdId, Long showId, Collection<Long> seatIds,
                                 String sessionToken, Long paymentAttemptId, String detail,
                                 LocalDateTime now) {
        LedgerEntry e = new LedgerEntry();
        e.action = action;
        e.holdId = holdId;
        e.showId = showId;
        e.seatIds = seatIds == null ? null
                : seatIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        e.sessionToken = sessionToken;
        e.paymentAttemptId = paymentAttemptId;
        e.detail = detail == null || detail.length() <= 500 ? detail : detail.substring(0, 500);
        e.createdAt = now;
        return e;
    }
}
