package com.lml.reservation.api.seat;

import com.lml.reservation.api.seat.dto.RecommendationResponse;
import com.lml.reservation.api.seat.dto.SeatResponse;
import com.lml.reservation.api.seat.dto.SelectionRequest;
import com.lml.reservation.api.seat.dto.ValidationResponse;
import com.lml.reservation.application.hold.SeatHoldService;
import com.lml.reservation.application.rules.BusinessRulesValidator;
import com.lml.reservation.application.rules.SelectionConstraints;
import com.lml.reservation.application.seat.SeatInventoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/shows/{showId}/seats")
public class SeatController {

    private final SeatInventoryService inventoryService;
    private final SeatHoldService seatHoldService;
    private final BusinessRulesValidator validator;

    @GetMapping
    public List<SeatResponse> seats(@PathVariable Long showId) {
        return inventoryService.getSeatsForShow(showId).stream()
                .map(SeatResponse::from)
                .toList();
    }

    @PostMapping("/validate")
    public ValidationResponse validate(@PathVariable Long showId, @Valid @RequestBody SelectionRequest request) {
        return ValidationResponse.from(seatHoldService.validate(showId, request.seatIds(), request.seatCodes(),
                new SelectionConstraints(request.customerAge(), request.allowedSectionIds())));
    }

    @GetMapping("/recommendations")
    public List<RecommendationResponse> recommendations(@PathVariable Long showId,
                                                        @RequestParam(defaultValue = "2") int count,
                                                        @RequestParam(required = false) Integer maxPricePence,
                                                        @RequestParam(required = false) String sectionId,
                                                        @RequestParam(defaultValue = "false") boolean accessibleOnly,
                                                        @RequestParam(required = false) Integer customerAge) {
        return validator.recommend(showId, count, maxPricePence, sectionId, accessibleOnly,
                        new SelectionConstraints(customerAge, null))
                .stream()
                .map(RecommendationResponse::from)
                .toList();
    }
}
