package com.lml.reservation.application.rules.rule;

import com.lml.reservation.application.rules.RejectReason;
import com.lml.reservation.application.rules.RuleVerdict;
import com.lml.reservation.application.rules.RulesProperties;
import com.lml.reservation.application.rules.SelectionConstraints;
import com.lml.reservation.application.rules.SelectionContext;
import com.lml.reservation.application.rules.SelectionRule;
import com.lml.reservation.application.seat.SeatSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Order(40)
@Component
@RequiredArgsConstructor
public class SectionRestrictionRule implements SelectionRule {

    private final RulesProperties properties;

    @Override
    public RuleVerdict check(SelectionContext context) {
        SelectionConstraints constraints = context.constraints();
        for (SeatSnapshot seat : context.requested()) {
            if (!constraints.allowsSection(seat.sectionId())) {
                return RuleVerdict.reject(RejectReason.SECTION_RESTRICTED,
                        "선택할 수 없는 구역입니다. section=" + seat.sectionId());
            }
            if (!properties.admits(seat.sectionId(), constraints.customerAge())) {
                return RuleVerdict.reject(RejectReason.SECTION_RESTRICTED,
                        seat.sectionId() + " 구역은 " + properties.minAgeFor(seat.sectionId()) + "세 이상만 예매할 수 있습니다.");
            }
        }
        return RuleVerdict.pass();
    }
}
