package com.lml.reservation.application.rules.rule;

import com.lml.reservation.application.rules.RejectReason;
import com.lml.reservation.application.rules.RuleVerdict;
import com.lml.reservation.application.rules.RulesProperties;
import com.lml.reservation.application.rules.SelectionContext;
import com.lml.reservation.application.rules.SelectionRule;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Order(20)
@Component
@RequiredArgsConstructor
public class MaxSeatsRule implements SelectionRule {

    private final RulesProperties properties;

    @Override
    public RuleVerdict check(SelectionContext context) {
        int requested = context.requestedIds().size();
        if (requested <= properties.maxSeats()) {
            return RuleVerdict.pass();
        }
        return RuleVerdict.reject(RejectReason.TOO_MANY_SEATS,
                "한 번에 최대 " + properties.maxSeats() + "석까지 선택할 수 있습니다. requested=" + requested);
    }
}
