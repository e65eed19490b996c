package com.lml.reservation.infra.seat;

import com.lml.reservation.domain.seat.Seat;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface SeatJpaRepository extends JpaRepository<Seat, Long> {

    List<Seat> findByShowIdOrderBySectionIdAscRowAscNumberAsc(Long showId);

    List<Seat> findByShowIdAndIdIn(Long showId, Collection<Long> ids);

    /**
     * 요청 좌석 row 락. 항상 id 오름차순으로 잡아서
     * 겹치는 좌석을 요청한 트랜잭션끼리 락 순서가 엇갈리지 않게 한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select s from Seat s
        where s.showId = :showId
          and s.id in :ids
        order by s.id
    """)
    List<Seat> findForUpdate(@Param("showId") Long showId,
                             @Param("ids") Collection<Long> ids);

    // 특정 홀드가 아직 가리키고 있는 좌석들 (다른 홀드가 가져간 좌석은 빠진다)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select s from Seat s
        where s.holdId = :holdId
          and s.status = com.lml.reservation.domain.seat.SeatStatus.HELD
        order by s.id
    """)
    List<Seat> findHeldByForUpdate(@Param("holdId") Long holdId);
}
