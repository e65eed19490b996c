package com.lml.reservation.domain.payment;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 외부 결제사 (PaymentIntent 생성).
 * 결과는 웹훅으로 따로 들어오므로 여기서는 참조값과 client secret 만 받는다.
 */
public interface PaymentProviderClient {

    /**
     * @param idempotencyKey 재시도해도 결제사 쪽에서 intent 가 하나만 생기게 하는 키
     */
    CompletableFuture<PaymentIntent> createPaymentIntent(long amountPence,
                                                         String currency,
                                                         String idempotencyKey,
                                                         Map<String, String> metadata);
}
