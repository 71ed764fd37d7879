package com.github.dimitryivaniuta.rpcgateway.proxy.metrics;

/**
 * Analytics sink. Fire-and-forget: implementations never throw and never block the caller.
 */
public interface RequestEventPublisher {

    void publish(RpcRequestEvent event);
}
