package com.lml.reservation.infra.payment;

import com.lml.reservation.domain.payment.PaymentIntent;
import com.lml.reservation.domain.payment.PaymentProviderClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 실제 결제사 대신 쓰는 목 구현. 결과 통지는 웹훅 API 를 직접 호출해서 흉내낸다.
 * 같은 idempotency key 면 같은 intent 를 돌려준다.
 */
@Slf4j
@Component
public class MockPaymentProviderClient implements PaymentProviderClient {

    private final Map<String, PaymentIntent> issued = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<PaymentIntent> createPaymentIntent(long amountPence, String currency,
                                                                String idempotencyKey,
                                                                Map<String, String> metadata) {
        PaymentIntent intent = issued.computeIfAbsent(idempotencyKey, k -> {
            String ref = "pi_" + UUID.randomUUID().toString().replace("-", "");
            return new PaymentIntent(ref, ref + "_secret_" + UUID.randomUUID().toString().substring(0, 8));
        });
        log.debug("mock payment intent. providerRef={}, amountPence={}, currency={}, metadata={}",
                intent.providerRef(), amountPence, currency, metadata);
        return CompletableFuture.completedFuture(intent);
    }
}
