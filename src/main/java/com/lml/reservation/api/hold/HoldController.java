package com.lml.reservation.api.hold;

import com.lml.reservation.api.hold.dto.BeginPaymentResponse;
import com.lml.reservation.api.hold.dto.HoldConflictResponse;
import com.lml.reservation.api.hold.dto.HoldRequest;
import com.lml.reservation.api.hold.dto.HoldResponse;
import com.lml.reservation.api.hold.dto.LedgerEntryResponse;
import com.lml.reservation.api.hold.dto.ReleaseResponse;
import com.lml.reservation.api.hold.dto.RenewRequest;
import com.lml.reservation.api.hold.dto.RenewResponse;
import com.lml.reservation.api.seat.dto.ValidationResponse;
import com.lml.reservation.application.hold.HoldCommand;
import com.lml.reservation.application.hold.HoldResult;
import com.lml.reservation.application.hold.HoldView;
import com.lml.reservation.application.hold.SeatHoldService;
import com.lml.reservation.application.ledger.ReservationLedger;
import com.lml.reservation.application.payment.PaymentCoordinator;
import com.lml.reservation.application.rules.SelectionConstraints;
import com.lml.reservation.common.exception.BusinessException;
import com.lml.reservation.common.exception.ErrorCode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/holds")
public class HoldController {

    static final String SESSION_HEADER = "X-Session-Token";

    private final SeatHoldService seatHoldService;
    private final PaymentCoordinator paymentCoordinator;
    private final ReservationLedger ledger;

    /**
     * 201: 홀드 성공, 409: 다른 고객이 먼저 잡은 좌석, 422: 규칙 위반(대안 좌석 포함)
     */
    @PostMapping
    public ResponseEntity<?> hold(@Valid @RequestBody HoldRequest request) {
        HoldResult result = seatHoldService.hold(new HoldCommand(
                request.showId(),
                request.seatIds(),
                request.seatCodes(),
                request.sessionToken(),
                request.userId(),
                request.ttlSeconds(),
                new SelectionConstraints(request.customerAge(), request.allowedSectionIds())
        ));

        return switch (result.outcome()) {
            case GRANTED -> ResponseEntity.status(HttpStatus.CREATED).body(HoldResponse.of(
                    HoldView.of(result.hold(), LocalDateTime.now()),
                    result.validation() == null ? List.of() : result.validation().warnings()));
            case CONFLICT -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(HoldConflictResponse.of(List.copyOf(result.conflictSeatIds())));
            case INVALID -> ResponseEntity.unprocessableEntity()
                    .body(ValidationResponse.from(result.validation()));
        };
    }

    @GetMapping("/{holdId}")
    public HoldResponse get(@PathVariable Long holdId) {
        return seatHoldService.getHold(holdId)
                .map(v -> HoldResponse.of(v, List.of()))
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLD_NOT_FOUND));
    }

    // 만료/종료/다른 세션이면 410
    @PostMapping("/{holdId}/renew")
    public RenewResponse renew(@PathVariable Long holdId, @Valid @RequestBody RenewRequest request) {
        if (!seatHoldService.renew(holdId, request.sessionToken())) {
            throw new BusinessException(ErrorCode.HOLD_GONE);
        }
        HoldView view = seatHoldService.getHold(holdId)
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLD_GONE));
        return new RenewResponse(holdId, view.expiresAt());
    }

    // 이미 해제/만료된 홀드도 200
    @DeleteMapping("/{holdId}")
    public ReleaseResponse release(@PathVariable Long holdId,
                                   @RequestHeader(SESSION_HEADER) String sessionToken) {
        if (!seatHoldService.release(holdId, sessionToken)) {
            throw new BusinessException(ErrorCode.HOLD_NOT_FOUND);
        }
        return new ReleaseResponse(holdId, true);
    }

    @PostMapping("/{holdId}/payment/begin")
    public BeginPaymentResponse beginPayment(@PathVariable Long holdId,
                                             @RequestHeader(SESSION_HEADER) String sessionToken) {
        return BeginPaymentResponse.from(paymentCoordinator.beginPayment(holdId, sessionToken));
    }

    @GetMapping("/{holdId}/history")
    public List<LedgerEntryResponse> history(@PathVariable Long holdId) {
        return ledger.history(holdId).stream()
                .map(LedgerEntryResponse::from)
                .toList();
    }
}
