package com.lml.reservation.application.rules.rule;

import com.lml.reservation.application.rules.RuleVerdict;
import com.lml.reservation.application.rules.SelectionContext;
import com.lml.reservation.application.rules.SelectionRule;
import com.lml.reservation.application.seat.SeatSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Order(60)
@Component
public class ContiguityRule implements SelectionRule {

    @Override
    public RuleVerdict check(SelectionContext context) {
        List<SeatSnapshot> seats = context.requested();
        if (seats.size() < 2) {
            return RuleVerdict.pass();
        }

        long rows = seats.stream().map(SelectionContext::rowKey).distinct().count();
        if (rows > 1) {
            return RuleVerdict.warn(List.of("선택한 좌석이 여러 열에 나뉘어 있습니다."));
        }

        int[] numbers = seats.stream().mapToInt(SeatSnapshot::number).sorted().toArray();
        if (numbers[numbers.length - 1] - numbers[0] != numbers.length - 1) {
            return RuleVerdict.warn(List.of("선택한 좌석 사이에 빈 자리가 있습니다."));
        }
        return RuleVerdict.pass();
    }
}
