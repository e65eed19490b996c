package com.lml.reservation.domain.payment;

import lombok.Getter;

/**
 * 결제사 호출 실패. retryable=true 면 타임아웃/일시 장애.
 */
@Getter
public class PaymentProviderException extends RuntimeException {

    private final boolean retryable;

    public PaymentProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public PaymentProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }
}
