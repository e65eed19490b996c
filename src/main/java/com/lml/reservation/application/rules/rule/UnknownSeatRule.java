package com.lml.reservation.application.rules.rule;

import com.lml.reservation.application.rules.RejectReason;
import com.lml.reservation.application.rules.RuleVerdict;
import com.lml.reservation.application.rules.SelectionContext;
import com.lml.reservation.application.rules.SelectionRule;
import com.lml.reservation.application.seat.SeatSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Order(10)
@Component
public class UnknownSeatRule implements SelectionRule {

    @Override
    public RuleVerdict check(SelectionContext context) {
        Set<Long> found = context.requested().stream()
                .map(SeatSnapshot::seatId)
                .collect(Collectors.toSet());
        Set<Long> unknown = context.requestedIds().stream()
                .filter(id -> !found.contains(id))
                .collect(Collectors.toCollection(TreeSet::new));
        if (unknown.isEmpty()) {
            return RuleVerdict.pass();
        }
        return RuleVerdict.reject(RejectReason.UNKNOWN_SEAT, "공연에 없는 좌석입니다. seatIds=" + unknown);
    }
}
