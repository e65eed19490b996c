package com.lml.reservation.application.rules;

import com.lml.reservation.application.seat.SeatSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 규칙들이 공유하는 입력. inventory 는 공연 전체 좌석의 유효 상태 스냅샷.
 */
public record SelectionContext(
        Long showId,
        Set<Long> requestedIds,
        List<SeatSnapshot> requested,
        List<SeatSnapshot> inventory,
        SelectionConstraints constraints
) {

    public static SelectionContext of(Long showId, Set<Long> requestedIds, List<SeatSnapshot> inventory,
                                      SelectionConstraints constraints) {
        List<SeatSnapshot> requested = inventory.stream()
                .filter(s -> requestedIds.contains(s.seatId()))
                .toList();
        return new SelectionContext(showId, Set.copyOf(requestedIds), requested, inventory,
                constraints == null ? SelectionConstraints.none() : constraints);
    }

    /** 같은 구역/열 좌석끼리 묶은 것. 키는 "sectionId|row". */
    public Map<String, List<SeatSnapshot>> inventoryByRow() {
        return inventory.stream().collect(Collectors.groupingBy(SelectionContext::rowKey));
    }

    public static String rowKey(SeatSnapshot s) {
        return s.sectionId() + "|" + s.row();
    }
}
