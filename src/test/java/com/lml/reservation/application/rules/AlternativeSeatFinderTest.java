package com.lml.reservation.application.rules;

import com.lml.reservation.application.seat.SeatSnapshot;
import com.lml.reservation.domain.seat.SeatStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlternativeSeatFinderTest {

    private final AlternativeSeatFinder finder = new AlternativeSeatFinder();

    private static SeatSnapshot seat(long id, String row, int number, SeatStatus status) {
        return new SeatSnapshot(id, 1L, "STALLS", row, number, 3000, false, status);
    }

    private static List<Long> ids(List<SeatSnapshot> block) {
        return block.stream().map(SeatSnapshot::seatId).toList();
    }

    @Test
    @DisplayName("번호가 끊긴 좌석은 연속 묶음으로 보지 않는다")
    void numberingGap_isNotContiguous() {
        List<SeatSnapshot> inventory = List.of(
                seat(1, "A", 1, SeatStatus.AVAILABLE),
                seat(2, "A", 2, SeatStatus.AVAILABLE),
                seat(4, "A", 4, SeatStatus.AVAILABLE),
                seat(5, "A", 5, SeatStatus.AVAILABLE));

        List<List<SeatSnapshot>> blocks = finder.findBlocks(inventory, 3, s -> true, List.of(), 5);

        assertThat(blocks).isEmpty();
    }

    @Test
    @DisplayName("AVAILABLE 이 아닌 좌석은 추천하지 않는다")
    void neverSuggestsUnavailable() {
        List<SeatSnapshot> inventory = List.of(
                seat(1, "A", 1, SeatStatus.AVAILABLE),
                seat(2, "A", 2, SeatStatus.HELD),
                seat(3, "A", 3, SeatStatus.AVAILABLE),
                seat(4, "A", 4, SeatStatus.SOLD),
                seat(5, "A", 5, SeatStatus.AVAILABLE));

        List<List<SeatSnapshot>> blocks = finder.findBlocks(inventory, 1, s -> true, List.of(), 10);

        assertThat(blocks).extracting(AlternativeSeatFinderTest::ids)
                .containsExactlyInAnyOrder(List.of(1L), List.of(3L), List.of(5L));
    }

    @Test
    @DisplayName("기준 좌석과 가까운 열만, limit 만큼만")
    void referenceDistance_orderAndLimit() {
        List<SeatSnapshot> inventory = List.of(
                seat(1, "A", 1, SeatStatus.AVAILABLE),
                seat(2, "A", 2, SeatStatus.AVAILABLE),
                seat(11, "B", 1, SeatStatus.HELD),
                seat(12, "B", 2, SeatStatus.HELD),
                seat(21, "C", 1, SeatStatus.AVAILABLE),
                seat(22, "C", 2, SeatStatus.AVAILABLE));
        List<SeatSnapshot> reference = List.of(seat(11, "B", 1, SeatStatus.HELD), seat(12, "B", 2, SeatStatus.HELD));

        List<List<SeatSnapshot>> blocks = finder.findBlocks(inventory, 2, s -> true, reference, 1);

        assertThat(blocks).hasSize(1);
        // A, C 열 거리가 같으면 좌석 id 순
        assertThat(ids(blocks.get(0))).containsExactly(1L, 2L);
    }
}
