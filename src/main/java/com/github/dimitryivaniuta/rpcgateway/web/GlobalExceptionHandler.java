package com.github.dimitryivaniuta.rpcgateway.web;

import com.github.dimitryivaniuta.rpcgateway.proxy.ErrorType;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayException;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.RateLimitExceededException;
import com.github.dimitryivaniuta.rpcgateway.proxy.support.TokenMasking;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

import static com.github.dimitryivaniuta.rpcgateway.proxy.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;
import static com.github.dimitryivaniuta.rpcgateway.proxy.web.RequestContextKeys.RETRY_AFTER_HEADER;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String code,
            String message,
            String path,
            String correlationId
    ) {}

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiError> handleRateLimit(RateLimitExceededException ex, HttpServletRequest req) {
        HttpHeaders h = new HttpHeaders();
        h.set(RETRY_AFTER_HEADER, String.valueOf(Math.max(0, ex.getRetryAfterSeconds()))); // seconds per RFC
        ApiError body = error(HttpStatus.TOO_MANY_REQUESTS, ex.getErrorType().code(), ex.getMessage(), req);
        return new ResponseEntity<>(body, h, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(RpcGatewayException.class)
    public ResponseEntity<ApiError> handleGateway(RpcGatewayException ex, HttpServletRequest req) {
        ErrorType type = ex.getErrorType();
        return ResponseEntity.status(type.status()).body(error(type.status(), type.code(), ex.getMessage(), req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(error(status, null, ex.getReason(), req));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(HttpStatus.BAD_REQUEST, null, "Validation failed", req));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethod(HttpRequestMethodNotSupportedException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(error(HttpStatus.METHOD_NOT_ALLOWED, null, ex.getMessage(), req));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(NoResourceFoundException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(error(HttpStatus.NOT_FOUND, null, ex.getMessage(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(HttpStatus.INTERNAL_SERVER_ERROR, null, "Unexpected error", req));
    }

    private ApiError error(HttpStatus status, String code, String message, HttpServletRequest req) {
        return new ApiError(
                Instant.now(),
                status.value(),
                status.getReasonPhrase(),
                code,
                (message == null || message.isBlank()) ? status.getReasonPhrase() : message,
                safePath(req),
                MDC.get(CORRELATION_ID_MDC_KEY)
        );
    }

    /** Authenticated routes are {@code /{chain}/{token}}: the token segment is masked. */
    static String safePath(HttpServletRequest req) {
        String uri = req.getRequestURI();
        if (uri == null || uri.startsWith("/api/") || uri.startsWith("/actuator/")) return uri;
        String[] parts = uri.split("/");
        if (parts.length == 3 && !parts[2].isEmpty()) {
            return "/" + parts[1] + "/" + TokenMasking.mask(parts[2]);
        }
        return uri;
    }
}
