package com.lml.reservation.domain.seat;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 레이아웃/레거시 좌석 코드(예: "ORCH-A-12") -> seatId 명시적 매핑.
 * 매핑이 없는 코드는 대체 좌석으로 바꾸지 않고 요청 자체를 거절한다.
 */
@Entity
@Table(
        name = "seat_alias",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_seat_alias_show_code", columnNames = {"show_id", "code"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SeatAlias {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "show_id", nullable = false)
    private Long showId;

    @Column(name = "code", nullable = false, length = 60)
    private String code;

    @Column(name = "seat_id", nullable = false)
    private Long seatId;

    public static SeatAlias of(Long showId, String code, Long seatId) {
        SeatAlias alias = new SeatAlias();
        alias.showId = showId;
        alias.code = normalize(code);
        alias.seatId = seatId;
        return alias;
    }

    public static String normalize(String raw) {
        return raw == null ? null : raw.trim().toUpperCase();
    }
}
