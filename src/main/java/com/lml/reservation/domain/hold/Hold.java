package com.lml.reservation.domain.hold;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 좌석 묶음에 대한 시간 제한 배타 홀드.
 *
 * 만료는 스윕이 돌기 전에도 읽는 시점에 판단한다:
 * ACTIVE 이면서 expiresAt 이 지났으면 어떤 reader 에게도 EXPIRED 로 보여야 한다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "hold",
        indexes = {
                @Index(name = "ix_hold_state_expires", columnList = "state, expires_at")
        }
)
public class Hold {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "show_id", nullable = false)
    private Long showId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "hold_seat", joinColumns = @JoinColumn(name = "hold_id"))
    @Column(name = "seat_id", nullable = false)
    private Set<Long> seatIds = new LinkedHashSet<>();

    @Column(name = "session_token", nullable = false, length = 120)
    private String sessionToken;

    // 게스트 허용
    @Column(name = "user_id", length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private HoldState state;

    @Column(name = "ttl_seconds", nullable = false)
    private long ttlSeconds;

    @Column(name = "renew_count", nullable = false)
    private int renewCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static Hold newHold(Long showId, Set<Long> seatIds, String sessionToken, String userId,
                               LocalDateTime now, Duration ttl) {
        if (seatIds == null || seatIds.isEmpty()) {
            throw new IllegalArgumentException("hold needs at least one seat");
        }
        Hold h = new Hold();
        h.showId = showId;
        h.seatIds = new TreeSet<>(seatIds);
        h.sessionToken = sessionToken;
        h.userId = userId;
        h.state = HoldState.ACTIVE;
        h.ttlSeconds = ttl.getSeconds();
        h.renewCount = 0;
        h.createdAt = now;
        h.expiresAt = now.plus(ttl);
        h.updatedAt = now;
        return h;
    }

    /** ACTIVE 이고 아직 만료 시각 전인 경우에만 true. */
    public boolean isLive(LocalDateTime now) {
        return state == HoldState.ACTIVE && now.isBefore(expiresAt);
    }

    /** 읽는 시점 기준 상태. 스윕 전이라도 만료된 ACTIVE 는 EXPIRED. */
    public HoldState effectiveState(LocalDateTime now) {
        if (state == HoldState.ACTIVE && !now.isBefore(expiresAt)) {
            return HoldState.EXPIRED;
        }
        return state;
    }

    public boolean isOwnedBy(String token) {
        return token != null && Objects.equals(sessionToken, token);
    }

    /**
     * 만료 시각을 원래 TTL 만큼 뒤로 민다.
     * 살아있지 않거나 연장 횟수를 다 쓴 경우 아무것도 바꾸지 않고 false.
     */
    public boolean renew(LocalDateTime now, int maxRenewals) {
        if (!isLive(now) || renewCount >= maxRenewals) {
            return false;
        }
        this.expiresAt = this.expiresAt.plusSeconds(ttlSeconds);
        this.renewCount += 1;
        this.updatedAt = now;
        return true;
    }

    public void promote(LocalDateTime now) {
        close(HoldState.PROMOTED, now);
    }

    public void release(LocalDateTime now) {
        close(HoldState.RELEASED, now);
    }

    public void expire(LocalDateTime now) {
        close(HoldState.EXPIRED, now);
    }

    private void close(HoldState terminal, LocalDateTime now) {
        if (state.isTerminal()) {
            throw new IllegalStateException("hold already terminal. holdId=" + id + ", state=" + state);
        }
        this.state = terminal;
        this.closedAt = now;
        this.updatedAt = now;
    }
}
