package com.lml.reservation.infra.ledger;

import com.lml.reservation.domain.ledger.LedgerAction;
import com.lml.reservation.domain.ledger.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerEntryJpaRepository extends JpaRepository<LedgerEntry, Long> {

    List<LedgerEntry> findByHoldIdOrderByIdAsc(Long holdId);

    long countByHoldIdAndAction(Long holdId, LedgerAction action);
}
