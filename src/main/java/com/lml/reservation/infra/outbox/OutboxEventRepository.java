package com.lml.reservation.infra.outbox;

import com.lml.reservation.domain.outbox.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    // 여러 인스턴스가 동시에 릴레이해도 같은 행을 두 번 집지 않도록 SKIP LOCKED
    @Query(value = """
        SELECT * FROM outbox_event
         WHERE status = 'PENDING'
           AND next_retry_at <= :now
         ORDER BY created_at
         LIMIT :limit
         FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEvent> lockPendingBatch(@Param("now") LocalDateTime now, @Param("limit") int limit);
}
