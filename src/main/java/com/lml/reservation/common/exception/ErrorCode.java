package com.lml.reservation.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "잘못된 요청입니다."),
    TRY_AGAIN(HttpStatus.SERVICE_UNAVAILABLE, "TRY_AGAIN", "일시적인 오류입니다. 잠시 후 다시 시도해주세요."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다."),

    // 좌석
    UNMAPPED_SEAT_CODE(HttpStatus.BAD_REQUEST, "UNMAPPED_SEAT_CODE", "매핑되지 않은 좌석 코드가 포함되어 있습니다."),

    // 홀드
    HOLD_NOT_FOUND(HttpStatus.NOT_FOUND, "HOLD_NOT_FOUND", "홀드가 존재하지 않습니다."),
    HOLD_GONE(HttpStatus.GONE, "HOLD_GONE", "이미 만료되었거나 종료된 홀드입니다."),

    // 결제
    PAYMENT_ATTEMPT_NOT_FOUND(HttpStatus.NOT_FOUND, "PAYMENT_ATTEMPT_NOT_FOUND", "결제 시도가 존재하지 않습니다."),
    PAYMENT_IN_PROGRESS(HttpStatus.CONFLICT, "PAYMENT_IN_PROGRESS", "결제 준비가 이미 진행 중입니다."),
    PAYMENT_PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "PAYMENT_PROVIDER_UNAVAILABLE", "결제 서비스에 연결할 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
