package com.lml.reservation.infra.booking;

import com.lml.reservation.domain.booking.Booking;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BookingJpaRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByHoldId(Long holdId);
}
