package com.github.dimitryivaniuta.rpcgateway.proxy;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by admission, dispatch and request events.
 * {@code code} is the stable value written into error bodies and metric tags.
 */
public enum ErrorType {

    TENANT_NOT_FOUND("tenant_not_found", HttpStatus.NOT_FOUND, "Tenant not found"),
    MONTHLY_LIMIT_EXCEEDED("monthly_limit_exceeded", HttpStatus.PAYMENT_REQUIRED, "Monthly limit exceeded"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded"),
    CHAIN_NOT_SUPPORTED("chain_not_supported", HttpStatus.NOT_FOUND, "Chain not supported or no nodes available"),
    UPSTREAM_ERROR("upstream_error", HttpStatus.BAD_GATEWAY, "Upstream error"),
    INVALID_REQUEST_BODY("invalid_request_body", HttpStatus.OK, "Request body is not valid JSON");

    private final String code;
    private final HttpStatus status;
    private final String defaultMessage;

    ErrorType(String code, HttpStatus status, String defaultMessage) {
        this.code = code;
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public String code() { return code; }

    public HttpStatus status() { return status; }

    public String defaultMessage() { return defaultMessage; }
}
