package com.lml.reservation.application.rules.rule;

import com.lml.reservation.application.rules.RuleVerdict;
import com.lml.reservation.application.rules.SelectionContext;
import com.lml.reservation.application.rules.SelectionRule;
import com.lml.reservation.application.seat.SeatSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 선택 후 열에 빈 좌석 하나만 덩그러니 남는 경우 경고.
 */
@Order(50)
@Component
public class OrphanSeatRule implements SelectionRule {

    @Override
    public RuleVerdict check(SelectionContext context) {
        Set<String> touchedRows = context.requested().stream()
                .map(SelectionContext::rowKey)
                .collect(Collectors.toSet());
        Map<String, List<SeatSnapshot>> byRow = context.inventoryByRow();

        List<String> warnings = new ArrayList<>();
        for (String key : touchedRows) {
            List<SeatSnapshot> row = byRow.getOrDefault(key, List.of()).stream()
                    .sorted(Comparator.comparingInt(SeatSnapshot::number))
                    .toList();
            for (int i = 0; i < row.size(); i++) {
                SeatSnapshot seat = row.get(i);
                if (!freeAfter(seat, context)) {
                    continue;
                }
                SeatSnapshot left = i > 0 ? row.get(i - 1) : null;
                SeatSnapshot right = i + 1 < row.size() ? row.get(i + 1) : null;
                boolean leftBlocked = left == null || left.number() != seat.number() - 1 || !freeAfter(left, context);
                boolean rightBlocked = right == null || right.number() != seat.number() + 1 || !freeAfter(right, context);
                boolean causedBySelection = isRequested(left, context) || isRequested(right, context);
                if (leftBlocked && rightBlocked && causedBySelection) {
                    warnings.add("좌석 " + seat.label() + " 이(가) 혼자 남게 됩니다.");
                }
            }
        }
        return RuleVerdict.warn(warnings);
    }

    private static boolean freeAfter(SeatSnapshot seat, SelectionContext context) {
        return seat.isAvailable() && !context.requestedIds().contains(seat.seatId());
    }

    private static boolean isRequested(SeatSnapshot seat, SelectionContext context) {
        return seat != null && context.requestedIds().contains(seat.seatId());
    }
}
