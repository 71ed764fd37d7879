package com.github.dimitryivaniuta.rpcgateway.proxy.metrics;

import com.github.dimitryivaniuta.rpcgateway.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Default sink: turns events into Micrometer meters and a debug log line, off the request thread.
 */
@Slf4j
@Component
public class MeterRequestEventPublisher implements RequestEventPublisher {

    private final GatewayMetrics metrics;
    private final Executor executor;

    public MeterRequestEventPublisher(GatewayMetrics metrics,
                                      @Qualifier(AsyncConfig.EVENT_EXECUTOR) Executor executor) {
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public void publish(RpcRequestEvent event) {
        try {
            executor.execute(() -> record(event));
        } catch (RejectedExecutionException ex) {
            log.debug("Event queue full, dropping event for chain {}", event.chain());
        }
    }

    private void record(RpcRequestEvent event) {
        try {
            String cache = event.cacheStatus().name();
            metrics.request(event.chain(), event.userType().tag(), cache, event.statusCode());
            metrics.recordDuration(event.chain(), cache, TimeUnit.MILLISECONDS.toNanos(event.latencyMs()));
            log.debug("rpc chain={} method={} cache={} status={} latencyMs={} req={}B res={}B error={}",
                    event.chain(), event.method(), cache, event.statusCode(), event.latencyMs(),
                    event.requestSize(), event.responseSize(), event.errorType());
        } catch (RuntimeException ex) {
            log.warn("Failed to record request event: {}", ex.getMessage());
        }
    }
}
