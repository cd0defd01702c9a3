package com.example.burn.http;

import com.example.burn.service.BurnException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    @ExceptionHandler({IllegalArgumentException.class, NullPointerException.class})
    public ResponseEntity<Map<String, Object>> badReq(RuntimeException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "BAD_REQUEST";
        return ResponseEntity.badRequest().body(Map.of("code", "BAD_REQUEST", "message", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(Map.of("code", "BAD_REQUEST", "message", "Malformed request body"));
    }

    @ExceptionHandler(BurnException.class)
    public ResponseEntity<Map<String, Object>> rejected(BurnException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case NOT_IN_GROUP -> HttpStatus.BAD_REQUEST;
            case BOT_NOT_PRIVILEGED, USER_OUTRANKS_BOT -> HttpStatus.FORBIDDEN;
            case ALREADY_ACTIVE, ACTIVE_IN_OTHER_GROUP, NOT_ACTIVE_HERE -> HttpStatus.CONFLICT;
            case GROUP_FULL -> HttpStatus.TOO_MANY_REQUESTS;
            case NOT_ACTIVE, UNKNOWN_CONNECTION -> HttpStatus.NOT_FOUND;
        };

        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", ex.getCode().name(),
                        "message", ex.getMessage()
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", "INTERNAL_ERROR", "message", message));
    }
}
