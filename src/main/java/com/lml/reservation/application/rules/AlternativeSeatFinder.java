package com.lml.reservation.application.rules;

import com.lml.reservation.application.seat.SeatSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 같은 구역/열에서 번호가 연속된 AVAILABLE 좌석 묶음 찾기.
 * 최적일 필요는 없다. AVAILABLE 아닌 좌석은 절대 추천하지 않는다.
 *
 * 기준 좌석이 있으면 가까운 순(같은 구역 -> 열 거리 -> 좌석 거리), 그 다음 가격.
 * 기준이 없으면 가격, 그 다음 열 가운데에 가까운 순.
 */
@Component
public class AlternativeSeatFinder {

    private static final double OTHER_SECTION_PENALTY = 1_000_000d;
    private static final double ROW_WEIGHT = 1_000d;

    public List<List<SeatSnapshot>> findBlocks(List<SeatSnapshot> inventory, int count,
                                               Predicate<SeatSnapshot> eligible,
                                               Collection<SeatSnapshot> reference, int limit) {
        if (count <= 0 || limit <= 0) {
            return List.of();
        }

        Map<String, List<SeatSnapshot>> rows = inventory.stream()
                .collect(Collectors.groupingBy(SelectionContext::rowKey));
        Map<String, Integer> rowIndex = rowIndex(inventory);
        Reference ref = Reference.of(reference, rowIndex);

        List<Candidate> candidates = new ArrayList<>();
        for (List<SeatSnapshot> row : rows.values()) {
            List<SeatSnapshot> sorted = row.stream()
                    .sorted(Comparator.comparingInt(SeatSnapshot::number))
                    .toList();
            int rowCenter = (sorted.get(0).number() + sorted.get(sorted.size() - 1).number()) / 2;

            for (int start = 0; start + count <= sorted.size(); start++) {
                List<SeatSnapshot> block = sorted.subList(start, start + count);
                if (isUsable(block, eligible)) {
                    candidates.add(Candidate.of(block, ref, rowIndex, rowCenter));
                }
            }
        }

        Comparator<Candidate> order = ref == null
                ? Comparator.comparingLong(Candidate::price).thenComparingDouble(Candidate::centerOffset)
                : Comparator.comparingDouble(Candidate::distance).thenComparingLong(Candidate::price);
        candidates.sort(order.thenComparing(c -> c.seats().get(0).seatId()));

        // 겹치는 묶음은 하나만
        List<List<SeatSnapshot>> picked = new ArrayList<>();
        Set<Long> used = new HashSet<>();
        for (Candidate c : candidates) {
            if (picked.size() >= limit) {
                break;
            }
            if (c.seats().stream().anyMatch(s -> used.contains(s.seatId()))) {
                continue;
            }
            c.seats().forEach(s -> used.add(s.seatId()));
            picked.add(List.copyOf(c.seats()));
        }
        return picked;
    }

    private static boolean isUsable(List<SeatSnapshot> block, Predicate<SeatSnapshot> eligible) {
        for (int i = 0; i < block.size(); i++) {
            SeatSnapshot s = block.get(i);
            if (!s.isAvailable() || !eligible.test(s)) {
                return false;
            }
            if (i > 0 && s.number() != block.get(i - 1).number() + 1) {
                return false;
            }
        }
        return true;
    }

    // 구역마다 열 이름을 (길이, 사전순)으로 정렬한 순번. A, B, ..., Z, AA
    private static Map<String, Integer> rowIndex(List<SeatSnapshot> inventory) {
        Map<String, List<String>> rowsBySection = inventory.stream()
                .collect(Collectors.groupingBy(SeatSnapshot::sectionId,
                        Collectors.mapping(SeatSnapshot::row, Collectors.toSet())))
                .entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().stream()
                        .sorted(Comparator.comparingInt(String::length).thenComparing(Function.identity()))
                        .toList()));

        Map<String, Integer> index = new HashMap<>();
        rowsBySection.forEach((section, rows) -> {
            for (int i = 0; i < rows.size(); i++) {
                index.put(section + "|" + rows.get(i), i);
            }
        });
        return index;
    }

    private record Reference(String sectionId, double rowIdx, double number) {

        static Reference of(Collection<SeatSnapshot> seats, Map<String, Integer> rowIndex) {
            if (seats == null || seats.isEmpty()) {
                return null;
            }
            String section = seats.stream()
                    .collect(Collectors.groupingBy(SeatSnapshot::sectionId, Collectors.counting()))
                    .entrySet().stream()
                    .max(Map.Entry.<String, Long>comparingByValue().thenComparing(Map.Entry.<String, Long>comparingByKey()))
                    .map(Map.Entry::getKey)
                    .orElseThrow();
            List<SeatSnapshot> inSection = seats.stream().filter(s -> s.sectionId().equals(section)).toList();
            double row = inSection.stream()
                    .mapToInt(s -> rowIndex.getOrDefault(SelectionContext.rowKey(s), 0))
                    .average().orElse(0);
            double number = inSection.stream().mapToInt(SeatSnapshot::number).average().orElse(0);
            return new Reference(section, row, number);
        }
    }

    private record Candidate(List<SeatSnapshot> seats, double distance, long price, double centerOffset) {

        static Candidate of(List<SeatSnapshot> block, Reference ref, Map<String, Integer> rowIndex, int rowCenter) {
            long price = block.stream().mapToLong(SeatSnapshot::pricePence).sum();
            double avgNumber = block.stream().mapToInt(SeatSnapshot::number).average().orElse(0);
            double centerOffset = Math.abs(avgNumber - rowCenter);

            double distance = 0;
            if (ref != null) {
                SeatSnapshot first = block.get(0);
                if (!first.sectionId().equals(ref.sectionId())) {
                    distance += OTHER_SECTION_PENALTY;
                }
                int row = rowIndex.getOrDefault(SelectionContext.rowKey(first), 0);
                distance += Math.abs(row - ref.rowIdx()) * ROW_WEIGHT;
                distance += Math.abs(avgNumber - ref.number());
            }
            return new Candidate(block, distance, price, centerOffset);
        }
    }
}
