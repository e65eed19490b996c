package com.lml.reservation.api.payment;

import com.lml.reservation.api.payment.dto.PaymentWebhookRequest;
import com.lml.reservation.api.payment.dto.PaymentWebhookResponse;
import com.lml.reservation.application.payment.PaymentCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private final PaymentCoordinator paymentCoordinator;

    // 결제사 웹훅. 재전송돼도 같은 결과를 돌려준다.
    @PostMapping("/webhook")
    public PaymentWebhookResponse webhook(@Valid @RequestBody PaymentWebhookRequest request) {
        return PaymentWebhookResponse.from(
                paymentCoordinator.handleWebhook(request.providerRef(), request.outcome()));
    }
}
