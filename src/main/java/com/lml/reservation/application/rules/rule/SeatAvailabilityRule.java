package com.lml.reservation.application.rules.rule;

import com.lml.reservation.application.rules.RejectReason;
import com.lml.reservation.application.rules.RuleVerdict;
import com.lml.reservation.application.rules.SelectionContext;
import com.lml.reservation.application.rules.SelectionRule;
import com.lml.reservation.application.seat.SeatSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

// 검증 시점 기준. 실제 판정은 HoldManager 트랜잭션이 한다.
@Order(30)
@Component
public class SeatAvailabilityRule implements SelectionRule {

    @Override
    public RuleVerdict check(SelectionContext context) {
        List<String> taken = context.requested().stream()
                .filter(s -> !s.isAvailable())
                .map(SeatSnapshot::label)
                .toList();
        if (taken.isEmpty()) {
            return RuleVerdict.pass();
        }
        return RuleVerdict.reject(RejectReason.SEAT_UNAVAILABLE, "이미 선택된 좌석이 있습니다. seats=" + taken);
    }
}
