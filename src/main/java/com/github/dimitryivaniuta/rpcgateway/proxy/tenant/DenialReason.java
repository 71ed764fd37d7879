package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import com.github.dimitryivaniuta.rpcgateway.proxy.ErrorType;

public enum DenialReason {
    TENANT_NOT_FOUND(ErrorType.TENANT_NOT_FOUND),
    MONTHLY_LIMIT(ErrorType.MONTHLY_LIMIT_EXCEEDED),
    RATE_LIMIT(ErrorType.RATE_LIMIT_EXCEEDED);

    private final ErrorType errorType;

    DenialReason(ErrorType errorType) {
        this.errorType = errorType;
    }

    public ErrorType errorType() { return errorType; }
}
