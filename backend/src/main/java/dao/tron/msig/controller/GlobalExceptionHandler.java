package dao.tron.msig.controller;

import dao.tron.msig.error.MultisigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MultisigException.class)
    public ResponseEntity<Map<String, Object>> handleMultisig(MultisigException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("{} [{}]: {}", ex.getCategory(), ex.getReason(), ex.getMessage());
        } else {
            log.warn("{} [{}]: {}", ex.getCategory(), ex.getReason(), ex.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("category", ex.getCategory().name());
        body.put("reason", ex.getReason().name());
        body.put("error", ex.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("category", "VALIDATION");
        body.put("error", detail);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("category", "AUTHORIZATION");
        body.put("error", "Missing header " + ex.getHeaderName());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
    }

    static HttpStatus statusFor(MultisigException ex) {
        switch (ex.getCategory()) {
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_STATE:
                return HttpStatus.CONFLICT;
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case RESOURCE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSPORT:
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
