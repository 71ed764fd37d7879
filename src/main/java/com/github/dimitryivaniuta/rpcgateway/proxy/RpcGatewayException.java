package com.github.dimitryivaniuta.rpcgateway.proxy;

import lombok.Getter;

@Getter
public class RpcGatewayException extends RuntimeException {

    private final ErrorType errorType;

    public RpcGatewayException(ErrorType errorType) {
        this(errorType, errorType.defaultMessage());
    }

    public RpcGatewayException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }
}
