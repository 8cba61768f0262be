package com.regimeplatform.forecast.exception;

import com.regimeplatform.common.exception.ForecastException;
import com.regimeplatform.common.exception.PredictionNotFoundException;
import com.regimeplatform.common.exception.TruthConflictException;
import com.regimeplatform.common.exception.ValidationException;
import com.regimeplatform.forecast.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e, ServerWebExchange exchange) {
        log.debug("[GlobalExceptionHandler] 422 path={} message={}", path(exchange), e.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, e, exchange);
    }

    @ExceptionHandler({PredictionNotFoundException.class, SnapshotNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(ForecastException e, ServerWebExchange exchange) {
        log.debug("[GlobalExceptionHandler] 404 path={} message={}", path(exchange), e.getMessage());
        return build(HttpStatus.NOT_FOUND, e, exchange);
    }

    @ExceptionHandler(TruthConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(TruthConflictException e, ServerWebExchange exchange) {
        log.warn("[GlobalExceptionHandler] 409 path={} message={}", path(exchange), e.getMessage());
        return build(HttpStatus.CONFLICT, e, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(ServerWebInputException e, ServerWebExchange exchange) {
        log.debug("[GlobalExceptionHandler] 400 path={} reason={}", path(exchange), e.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("BAD_REQUEST", e.getReason(), path(exchange), Instant.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, ServerWebExchange exchange) {
        log.error("[GlobalExceptionHandler] 500 path={}", path(exchange), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", e.getClass().getSimpleName(), path(exchange), Instant.now()));
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, ForecastException e, ServerWebExchange exchange) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), path(exchange), Instant.now()));
    }

    private static String path(ServerWebExchange exchange) {
        return exchange != null ? exchange.getRequest().getPath().value() : "/";
    }
}
