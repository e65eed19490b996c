package com.lml.reservation.application.ledger;

import com.lml.reservation.domain.ledger.LedgerAction;
import com.lml.reservation.domain.ledger.LedgerEntry;
import com.lml.reservation.infra.ledger.LedgerEntryJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * append-only 감사 기록. 기록 대상 상태 변경과 같은 트랜잭션에 들어간다.
 */
@Component
@RequiredArgsConstructor
public class ReservationLedger {

    private final LedgerEntryJpaRepository ledgerRepository;

    @Transactional
    public void record(LedgerAction action, Long holdId, Long showId, Collection<Long> seatIds,
                       String sessionToken, String detail) {
        ledgerRepository.save(LedgerEntry.of(action, holdId, showId, seatIds, sessionToken,
                null, detail, LocalDateTime.now()));
    }

    @Transactional
    public void recordPayment(LedgerAction action, Long holdId, Long showId, Collection<Long> seatIds,
                              Long paymentAttemptId, String detail) {
        ledgerRepository.save(LedgerEntry.of(action, holdId, showId, seatIds, null,
                paymentAttemptId, detail, LocalDateTime.now()));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> history(Long holdId) {
        return ledgerRepository.findByHoldIdOrderByIdAsc(holdId);
    }
}
