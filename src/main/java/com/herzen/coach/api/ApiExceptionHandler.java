package com.herzen.coach.api;

import com.herzen.coach.engine.InvalidContextException;
import com.herzen.coach.history.RecordNotFoundException;
import com.herzen.coach.strategy.StrategyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ErrorResponse(String error, String message) {}

    @ExceptionHandler(StrategyNotFoundException.class)
    public ResponseEntity<ErrorResponse> strategyNotFound(StrategyNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "strategy_not_found", e.getMessage());
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> recordNotFound(RecordNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "record_not_found", e.getMessage());
    }

    @ExceptionHandler(InvalidContextException.class)
    public ResponseEntity<ErrorResponse> invalidContext(InvalidContextException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_context", e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        log.debug("Request failed with {}: {}", status.value(), message);
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
