package com.lml.reservation.api.advice;

import com.lml.reservation.common.exception.BusinessException;
import com.lml.reservation.common.exception.ErrorCode;
import com.lml.reservation.common.retry.TransientRetry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException e, HttpServletRequest req) {
        ErrorCode ec = e.getErrorCode();
        if (ec.getHttpStatus().is5xxServerError()) {
            log.warn("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.toString());
        }
        return respond(ec, e.getMessage(), req);
    }

    // ===== 요청 형식 오류 =====
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e, HttpServletRequest req) {
        String message = e.getBindingResult().getAllErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        return respond(ErrorCode.INVALID_REQUEST, message, req);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformed(Exception e, HttpServletRequest req) {
        return respond(ErrorCode.INVALID_REQUEST, ErrorCode.INVALID_REQUEST.getMessage(), req);
    }

    // ===== DB 관련 예외 =====
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest req) {
        if (TransientRetry.isTransient(e)) {
            log.warn("[DB_BUSY] {} {} - {}", req.getMethod(), req.getRequestURI(), e.toString());
            return respond(ErrorCode.TRY_AGAIN, ErrorCode.TRY_AGAIN.getMessage(), req);
        }
        log.error("[DB_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return respond(ErrorCode.INTERNAL_ERROR, "데이터베이스 오류가 발생했습니다.", req);
    }

    // ===== 그 외 모든 예외 =====
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAny(Exception e, HttpServletRequest req) {
        log.error("[INTERNAL_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return respond(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage(), req);
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorCode ec, String message, HttpServletRequest req) {
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, message, req.getRequestURI()));
    }

    private static String describe(ObjectError error) {
        if (error instanceof FieldError fe) {
            return fe.getField() + ": " + fe.getDefaultMessage();
        }
        return error.getDefaultMessage();
    }
}
