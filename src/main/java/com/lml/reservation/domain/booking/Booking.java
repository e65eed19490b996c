package com.lml.reservation.domain.booking;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.TreeSet;

/**
 * 결제 완료로 승격된 홀드 하나에서만 만들어지는 확정 예매.
 * hold_id 유니크 제약으로 같은 홀드에서 두 번 만들어지지 않는다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "booking",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_booking_hold", columnNames = {"hold_id"})
        }
)
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hold_id", nullable = false)
    private Long holdId;

    @Column(name = "show_id", nullable = false)
    private Long showId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_seat", joinColumns = @JoinColumn(name = "booking_id"))
    @Column(name = "seat_id", nullable = false)
    private Set<Long> seatIds = new TreeSet<>();

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "customer_email", length = 200)
    private String customerEmail;

    @Column(name = "total_amount_pence", nullable = false)
    private long totalAmountPence;

    @Column(name = "payment_reference", length = 120)
    private String paymentReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Booking fromHold(Long holdId, Long showId, Set<Long> seatIds, String userId,
                                   String customerEmail, long totalAmountPence,
                                   String paymentReference, LocalDateTime now) {
        Booking b = new Booking();
        b.holdId = holdId;
        b.showId = showId;
        b.seatIds = new TreeSet<>(seatIds);
        b.userId = userId;
        b.customerEmail = customerEmail;
        b.totalAmountPence = totalAmountPence;
        b.paymentReference = paymentReference;
        b.createdAt = now;
        return b;
    }
}
