package com.lml.reservation.application.rules.rule;

import com.lml.reservation.application.rules.RuleVerdict;
import com.lml.reservation.application.rules.SelectionContext;
import com.lml.reservation.application.rules.SelectionRule;
import com.lml.reservation.application.seat.SeatSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Order(70)
@Component
public class AccessibilityMixRule implements SelectionRule {

    @Override
    public RuleVerdict check(SelectionContext context) {
        List<SeatSnapshot> seats = context.requested();
        boolean anyAccessible = seats.stream().anyMatch(SeatSnapshot::accessible);
        boolean anyStandard = seats.stream().anyMatch(s -> !s.accessible());
        if (anyAccessible && anyStandard) {
            return RuleVerdict.warn(List.of("휠체어석과 일반석이 섞여 있습니다."));
        }
        return RuleVerdict.pass();
    }
}
