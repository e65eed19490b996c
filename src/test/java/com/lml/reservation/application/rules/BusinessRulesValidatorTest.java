package com.lml.reservation.application.rules;

import com.lml.reservation.application.rules.rule.AccessibilityMixRule;
import com.lml.reservation.application.rules.rule.ContiguityRule;
import com.lml.reservation.application.rules.rule.MaxSeatsRule;
import com.lml.reservation.application.rules.rule.OrphanSeatRule;
import com.lml.reservation.application.rules.rule.SeatAvailabilityRule;
import com.lml.reservation.application.rules.rule.SectionRestrictionRule;
import com.lml.reservation.application.rules.rule.UnknownSeatRule;
import com.lml.reservation.application.seat.SeatInventoryService;
import com.lml.reservation.application.seat.SeatSnapshot;
import com.lml.reservation.domain.seat.SeatStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

class BusinessRulesValidatorTest {

    private static final Long SHOW = 1L;

    private final SeatInventoryService inventoryService = mock(SeatInventoryService.class);
    private BusinessRulesValidator validator;
    private List<SeatSnapshot> inventory;

    @BeforeEach
    void setUp() {
        RulesProperties properties = new RulesProperties(8, Map.of("balcony", 16), new RulesProperties.Alternatives(3));
        validator = new BusinessRulesValidator(inventoryService, new AlternativeSeatFinder(), List.of(
                new UnknownSeatRule(),
                new MaxSeatsRule(properties),
                new SeatAvailabilityRule(),
                new SectionRestrictionRule(properties),
                new OrphanSeatRule(),
                new ContiguityRule(),
                new AccessibilityMixRule()
        ), properties);

        // STALLS A: id 1~6 (4000), STALLS B: id 11~16 (3000), BALCONY A: id 21~24 (2000)
        inventory = new ArrayList<>();
        for (int n = 1; n <= 6; n++) {
            inventory.add(seat(n, "STALLS", "A", n, 4000, false, SeatStatus.AVAILABLE));
        }
        for (int n = 1; n <= 6; n++) {
            inventory.add(seat(10 + n, "STALLS", "B", n, 3000, false, SeatStatus.AVAILABLE));
        }
        for (int n = 1; n <= 4; n++) {
            inventory.add(seat(20 + n, "BALCONY", "A", n, 2000, false, SeatStatus.AVAILABLE));
        }
        given(inventoryService.getSeatsForShow(SHOW)).willAnswer(inv -> inventory);
    }

    private static SeatSnapshot seat(long id, String section, String row, int number, int price,
                                     boolean accessible, SeatStatus status) {
        return new SeatSnapshot(id, SHOW, section, row, number, price, accessible, status);
    }

    private void replace(long id, SeatStatus status, boolean accessible) {
        inventory.replaceAll(s -> s.seatId() == id
                ? seat(id, s.sectionId(), s.row(), s.number(), s.pricePence(), accessible, status)
                : s);
    }

    @Test
    @DisplayName("빈 선택은 EMPTY_SELECTION")
    void emptySelection() {
        ValidationResult result = validator.validateSelection(SHOW, Set.of(), SelectionConstraints.none());

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo(RejectReason.EMPTY_SELECTION);
    }

    @Test
    @DisplayName("공연에 없는 좌석은 UNKNOWN_SEAT")
    void unknownSeat() {
        ValidationResult result = validator.validateSelection(SHOW, Set.of(1L, 99L), SelectionConstraints.none());

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo(RejectReason.UNKNOWN_SEAT);
        assertThat(result.message()).contains("99");
    }

    @Test
    @DisplayName("인원 상한 초과는 TOO_MANY_SEATS, 대안 좌석 없음")
    void tooManySeats() {
        Set<Long> nine = Set.of(1L, 2L, 3L, 4L, 5L, 6L, 11L, 12L, 13L);

        ValidationResult result = validator.validateSelection(SHOW, nine, SelectionConstraints.none());

        assertThat(result.reason()).isEqualTo(RejectReason.TOO_MANY_SEATS);
        assertThat(result.suggestedAlternatives()).isEmpty();
    }

    @Test
    @DisplayName("이미 잡힌 좌석이 있으면 SEAT_UNAVAILABLE + 가까운 대안 좌석")
    void unavailable_suggestsNearestAvailableBlocks() {
        replace(3L, SeatStatus.HELD, false);

        ValidationResult result = validator.validateSelection(SHOW, Set.of(3L, 4L), SelectionConstraints.none());

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo(RejectReason.SEAT_UNAVAILABLE);
        // 같은 열 -> 가까운 순, 겹치는 묶음 제외, 나이 제한 구역 제외
        assertThat(result.suggestedAlternatives())
                .containsExactly(List.of(4L, 5L), List.of(1L, 2L), List.of(13L, 14L));
        assertThat(result.suggestedAlternatives()).allSatisfy(block -> assertThat(block).doesNotContain(3L));
    }

    @Test
    @DisplayName("나이 제한 구역: 나이 미달이면 SECTION_RESTRICTED, 충족하면 통과")
    void ageRestrictedSection() {
        ValidationResult young = validator.validateSelection(SHOW, Set.of(21L, 22L), new SelectionConstraints(12, null));
        ValidationResult adult = validator.validateSelection(SHOW, Set.of(21L, 22L), new SelectionConstraints(20, null));

        assertThat(young.reason()).isEqualTo(RejectReason.SECTION_RESTRICTED);
        assertThat(young.suggestedAlternatives()).isNotEmpty()
                .allSatisfy(block -> assertThat(block).allMatch(id -> id < 20));
        assertThat(adult.valid()).isTrue();
    }

    @Test
    @DisplayName("허용 구역 밖 좌석은 SECTION_RESTRICTED")
    void outsideAllowedSections() {
        ValidationResult result = validator.validateSelection(SHOW, Set.of(1L),
                new SelectionConstraints(30, Set.of("BALCONY")));

        assertThat(result.reason()).isEqualTo(RejectReason.SECTION_RESTRICTED);
        assertThat(result.suggestedAlternatives()).allSatisfy(block -> assertThat(block).allMatch(id -> id > 20));
    }

    @Test
    @DisplayName("여러 열에 걸친 선택은 경고만 하고 통과, 혼자 남는 좌석도 경고")
    void splitRows_warns() {
        ValidationResult result = validator.validateSelection(SHOW, Set.of(1L, 12L), SelectionConstraints.none());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings())
                .anySatisfy(w -> assertThat(w).contains("여러 열"))
                .anySatisfy(w -> assertThat(w).contains("STALLS:B1"));
    }

    @Test
    @DisplayName("사이에 빈 자리가 있는 선택은 경고")
    void gap_warns() {
        ValidationResult result = validator.validateSelection(SHOW, Set.of(1L, 3L), SelectionConstraints.none());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("빈 자리"));
    }

    @Test
    @DisplayName("휠체어석과 일반석 혼합은 경고")
    void accessibilityMix_warns() {
        replace(6L, SeatStatus.AVAILABLE, true);

        ValidationResult result = validator.validateSelection(SHOW, Set.of(5L, 6L), SelectionConstraints.none());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("휠체어석"));
    }

    @Test
    @DisplayName("연속된 좌석 한 묶음은 경고 없이 통과")
    void contiguousBlock_clean() {
        ValidationResult result = validator.validateSelection(SHOW, Set.of(3L, 4L), SelectionConstraints.none());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("recommend: 가격 상한 안에서 싼 묶음, 같은 값이면 열 가운데 우선")
    void recommend_byPriceThenCenter() {
        List<List<SeatSnapshot>> blocks = validator.recommend(SHOW, 2, 3000, null, false, SelectionConstraints.none());

        assertThat(blocks).extracting(b -> b.stream().map(SeatSnapshot::seatId).toList())
                .containsExactly(List.of(12L, 13L), List.of(14L, 15L));
    }

    @Test
    @DisplayName("recommend: 구역 지정 + 나이 충족")
    void recommend_sectionFilter() {
        List<List<SeatSnapshot>> blocks = validator.recommend(SHOW, 4, null, "BALCONY", false,
                new SelectionConstraints(18, null));

        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0)).extracting(SeatSnapshot::seatId).containsExactly(21L, 22L, 23L, 24L);
    }

    @Test
    void recommend_invalidCountOrNoMatch_isEmpty() {
        assertThat(validator.recommend(SHOW, 0, null, null, false, null)).isEmpty();
        assertThat(validator.recommend(SHOW, 9, null, null, false, null)).isEmpty();
        assertThat(validator.recommend(SHOW, 2, null, null, true, null)).isEmpty();
    }
}
