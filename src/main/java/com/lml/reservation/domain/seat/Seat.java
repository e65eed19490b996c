package com.lml.reservation.domain.seat;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 공연(show)별 좌석 인벤토리 한 칸.
 * status / holdId 전이는 HoldManager 만 수행한다.
 */
@Entity
@Table(
        name = "seat",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_seat_show_position",
                        columnNames = {"show_id", "section_id", "row_label", "seat_number"}
                )
        },
        indexes = {
                @Index(name = "ix_seat_hold", columnList = "hold_id"),
                @Index(name = "ix_seat_show", columnList = "show_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Seat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "show_id", nullable = false)
    private Long showId;

    @Column(name = "section_id", nullable = false, length = 40)
    private String sectionId;

    // "A", "B" ... 같은 열 이름
    @Column(name = "row_label", nullable = false, length = 10)
    private String row;

    @Column(name = "seat_number", nullable = false)
    private int number;

    @Column(name = "price_pence", nullable = false)
    private int pricePence;

    @Column(name = "accessible", nullable = false)
    private boolean accessible;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SeatStatus status;

    // status = HELD 일 때만 값이 있다
    @Column(name = "hold_id")
    private Long holdId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static Seat create(Long showId, String sectionId, String row, int number,
                              int pricePence, boolean accessible) {
        Seat seat = new Seat();
        seat.showId = showId;
        seat.sectionId = sectionId;
        seat.row = row;
        seat.number = number;
        seat.pricePence = pricePence;
        seat.accessible = accessible;
        seat.status = SeatStatus.AVAILABLE;
        seat.createdAt = LocalDateTime.now();
        seat.updatedAt = seat.createdAt;
        return seat;
    }

    public void hold(Long holdId, LocalDateTime now) {
        if (status == SeatStatus.SOLD) {
            throw new IllegalStateException("sold seat cannot be held. seatId=" + id);
        }
        this.status = SeatStatus.HELD;
        this.holdId = holdId;
        this.updatedAt = now;
    }

    public void sell(LocalDateTime now) {
        if (status != SeatStatus.HELD) {
            throw new IllegalStateException("only a held seat can be sold. seatId=" + id + ", status=" + status);
        }
        this.status = SeatStatus.SOLD;
        this.holdId = null;
        this.updatedAt = now;
    }

    public void free(LocalDateTime now) {
        if (status == SeatStatus.SOLD) {
            throw new IllegalStateException("sold seat cannot be freed. seatId=" + id);
        }
        this.status = SeatStatus.AVAILABLE;
        this.holdId = null;
        this.updatedAt = now;
    }

    public boolean isHeldBy(Long holdId) {
        return status == SeatStatus.HELD && holdId != null && holdId.equals(this.holdId);
    }

    public String label() {
        return sectionId + ":" + row + number;
    }
}
