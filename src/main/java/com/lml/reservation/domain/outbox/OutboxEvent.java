package com.lml.reservation.domain.outbox;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 좌석 상태 변경을 같은 트랜잭션 안에서 적재해두는 transactional outbox 행.
 * 커밋된 변경만 릴레이되고, 릴레이는 at-least-once 다.
 */
@Entity
@Table(
        name = "outbox_event",
        indexes = {
                @Index(name = "ix_outbox_pending", columnList = "status, next_retry_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    private static final int MAX_BACKOFF_SECONDS = 60;

    @Id
    @Column(name = "event_id", length = 64, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "topic", length = 120, nullable = false)
    private String topic;

    // Kafka 파티션 키 (showId) -> 공연 단위 순서 유지
    @Column(name = "event_key", length = 120, nullable = false)
    private String eventKey;

    @Lob
    @Column(name = "payload", columnDefinition = "json", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private OutboxStatus status;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retry", nullable = false)
    private int maxRetry;

    @Column(name = "next_retry_at", nullable = false)
    private LocalDateTime nextRetryAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static OutboxEvent pending(String topic, String eventKey, String payload,
                                      int maxRetry, LocalDateTime now) {
        OutboxEvent e = new OutboxEvent();
        e.eventId = UUID.randomUUID().toString();
        e.topic = topic;
        e.eventKey = eventKey;
        e.payload = payload;
        e.status = OutboxStatus.PENDING;
        e.retryCount = 0;
        e.maxRetry = Math.max(1, maxRetry);
        e.nextRetryAt = now;
        e.createdAt = now;
        e.updatedAt = now;
        return e;
    }

    public void markPublished(LocalDateTime now) {
        this.status = OutboxStatus.PUBLISHED;
        this.publishedAt = now;
        this.lastError = null;
        this.updatedAt = now;
    }

    /**
     * 재시도 횟수를 올리고, 한도에 닿으면 FAILED.
     * 아니면 PENDING 유지 + 지수 backoff (2,4,8,...,60초).
     */
    public void markRetryOrFail(String errorMessage, LocalDateTime now) {
        this.retryCount += 1;
        this.lastError = errorMessage == null || errorMessage.length() <= 500
                ? errorMessage
                : errorMessage.substring(0, 500);
        this.updatedAt = now;

        if (this.retryCount >= this.maxRetry) {
            this.status = OutboxStatus.FAILED;
            return;
        }
        this.status = OutboxStatus.PENDING;
        this.nextRetryAt = now.plusSeconds(backoffSeconds(retryCount));
    }

    static int backoffSeconds(int retryCount) {
        return Math.min(MAX_BACKOFF_SECONDS, 1 << Math.min(6, retryCount));
    }
}
