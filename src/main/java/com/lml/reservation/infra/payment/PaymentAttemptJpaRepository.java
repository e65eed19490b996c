package com.lml.reservation.infra.payment;

import com.lml.reservation.domain.payment.PaymentAttempt;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PaymentAttemptJpaRepository extends JpaRepository<PaymentAttempt, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from PaymentAttempt a where a.id = :id")
    Optional<PaymentAttempt> findByIdForUpdate(@Param("id") Long id);

    // 홀드당 live=1 인 시도는 최대 하나
    Optional<PaymentAttempt> findByHoldIdAndLive(Long holdId, Integer live);

    Optional<PaymentAttempt> findByProviderRef(String providerRef);
}
