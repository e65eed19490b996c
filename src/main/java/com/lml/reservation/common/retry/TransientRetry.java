package com.lml.reservation.common.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 일시적 장애(락 대기 타임아웃, 데드락, 커넥션 끊김)를 짧게 재시도한다.
 * - 매 시도는 호출 대상의 새 트랜잭션이어야 한다 (트랜잭션 안에서 호출하지 말 것)
 * - 충돌/이미 종료된 홀드 같은 경합 결과는 예외가 아니라 결과값이므로 여기서 재시도하지 않는다
 */
@Slf4j
@Component
public class TransientRetry {

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public TransientRetry(@Value("${ticketing.retry.max-attempts:5}") int maxAttempts,
                          @Value("${ticketing.retry.initial-backoff-ms:10}") long initialBackoffMs,
                          @Value("${ticketing.retry.max-backoff-ms:200}") long maxBackoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public <T> T call(String operation, Supplier<T> action) {
        return call(operation, action, TransientRetry::isTransient);
    }

    public <T> T call(String operation, Supplier<T> action, Predicate<RuntimeException> retryable) {
        long backoffMs = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e) || attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Transient failure, retrying. op={}, attempt={}/{}, backoffMs={}, err={}",
                        operation, attempt, maxAttempts, backoffMs, e.toString());
                sleep(backoffMs);
                backoffMs = Math.min(backoffMs * 2, maxBackoffMs);
            }
        }
    }

    public static boolean isTransient(RuntimeException e) {
        // CannotAcquireLockException, DeadlockLoserDataAccessException, QueryTimeoutException 등 포함
        return e instanceof TransientDataAccessException
                || e instanceof PessimisticLockingFailureException;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while backing off", ie);
        }
    }
}
