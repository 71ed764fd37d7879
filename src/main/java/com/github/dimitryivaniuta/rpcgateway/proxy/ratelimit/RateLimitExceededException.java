package com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit;

import com.github.dimitryivaniuta.rpcgateway.proxy.ErrorType;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayException;
import lombok.Getter;

/**
 * Raised for both the per-tenant bucket and the public per-address limiter.
 * Rendered as 429 with a Retry-After header.
 */
@Getter
public class RateLimitExceededException extends RpcGatewayException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(ErrorType.RATE_LIMIT_EXCEEDED, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
