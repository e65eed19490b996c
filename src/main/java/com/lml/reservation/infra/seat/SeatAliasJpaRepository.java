package com.lml.reservation.infra.seat;

import com.lml.reservation.domain.seat.SeatAlias;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface SeatAliasJpaRepository extends JpaRepository<SeatAlias, Long> {

    List<SeatAlias> findByShowIdAndCodeIn(Long showId, Collection<String> codes);
}
