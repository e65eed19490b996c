package com.lml.reservation.infra.hold;

import com.lml.reservation.domain.hold.Hold;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface HoldJpaRepository extends JpaRepository<Hold, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from Hold h where h.id = :id")
    Optional<Hold> findByIdForUpdate(@Param("id") Long id);

    // 좌석을 잡고 있는 기존 홀드들. 좌석 락 이후에 id 순으로 잠근다.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from Hold h where h.id in :ids order by h.id")
    List<Hold> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    // 스윕 대상: 오래 만료된 것부터
    @Query("""
        select h.id from Hold h
        where h.state = com.lml.reservation.domain.hold.HoldState.ACTIVE
          and h.expiresAt < :now
        order by h.expiresAt
    """)
    List<Long> findExpiredIds(@Param("now") LocalDateTime now, Pageable pageable);
}
