package com.lml.reservation.application.rules;

import com.lml.reservation.application.seat.SeatInventoryService;
import com.lml.reservation.application.seat.SeatSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * tryHold 앞단의 입장 제어. 좌석 상태를 바꾸지 않는다.
 * 규칙은 순서대로 돌고 첫 거절에서 멈춘다. 경고는 누적한다.
 */
@Slf4j
@Service
public class BusinessRulesValidator {

    private final SeatInventoryService inventoryService;
    private final AlternativeSeatFinder alternativeFinder;
    private final List<SelectionRule> rules;
    private final RulesProperties properties;

    // 스프링이 @Order 순으로 정렬해서 넣어준다
    public BusinessRulesValidator(SeatInventoryService inventoryService,
                                  AlternativeSeatFinder alternativeFinder,
                                  List<SelectionRule> rules,
                                  RulesProperties properties) {
        this.inventoryService = inventoryService;
        this.alternativeFinder = alternativeFinder;
        this.rules = List.copyOf(rules);
        this.properties = properties;
    }

    public ValidationResult validateSelection(Long showId, Set<Long> seatIds, SelectionConstraints constraints) {
        if (seatIds == null || seatIds.isEmpty()) {
            return ValidationResult.rejected(RejectReason.EMPTY_SELECTION, "좌석을 한 개 이상 선택해주세요.");
        }

        List<SeatSnapshot> inventory = inventoryService.getSeatsForShow(showId);
        SelectionContext context = SelectionContext.of(showId, seatIds, inventory, constraints);

        List<String> warnings = new ArrayList<>();
        for (SelectionRule rule : rules) {
            RuleVerdict verdict = rule.check(context);
            if (verdict.rejected()) {
                log.debug("selection rejected. showId={}, seatIds={}, reason={}",
                        showId, seatIds, verdict.rejectReason());
                return ValidationResult.rejected(verdict.rejectReason(), verdict.message())
                        .withWarnings(warnings)
                        .withAlternatives(alternativesFor(verdict.rejectReason(), context));
            }
            warnings.addAll(verdict.warnings());
        }
        return ValidationResult.ok(warnings);
    }

    /**
     * 기준 좌석 없이 추천.
     *
     * @param maxPricePence 좌석 한 개 가격 상한, null 이면 제한 없음
     */
    public List<List<SeatSnapshot>> recommend(Long showId, int count, Integer maxPricePence,
                                              String sectionId, boolean accessibleOnly,
                                              SelectionConstraints constraints) {
        if (count <= 0 || count > properties.maxSeats()) {
            return List.of();
        }
        SelectionConstraints c = constraints == null ? SelectionConstraints.none() : constraints;
        Predicate<SeatSnapshot> eligible = eligibleFor(c)
                .and(s -> maxPricePence == null || s.pricePence() <= maxPricePence)
                .and(s -> sectionId == null || sectionId.equals(s.sectionId()))
                .and(s -> !accessibleOnly || s.accessible());

        return alternativeFinder.findBlocks(inventoryService.getSeatsForShow(showId), count, eligible,
                List.of(), properties.alternatives().maxSuggestions());
    }

    private List<List<Long>> alternativesFor(RejectReason reason, SelectionContext context) {
        if (reason == RejectReason.TOO_MANY_SEATS || reason == RejectReason.EMPTY_SELECTION) {
            return List.of();
        }
        int count = context.requestedIds().size();
        return alternativeFinder.findBlocks(context.inventory(), count, eligibleFor(context.constraints()),
                        context.requested(), properties.alternatives().maxSuggestions())
                .stream()
                .map(block -> block.stream().map(SeatSnapshot::seatId).toList())
                .toList();
    }

    private Predicate<SeatSnapshot> eligibleFor(SelectionConstraints constraints) {
        return s -> constraints.allowsSection(s.sectionId())
                && properties.admits(s.sectionId(), constraints.customerAge());
    }
}
