package com.lml.reservation.infra.payment;

import com.lml.reservation.domain.payment.ReconciliationCase;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReconciliationCaseJpaRepository extends JpaRepository<ReconciliationCase, Long> {

    boolean existsByPaymentAttemptId(Long paymentAttemptId);
}
