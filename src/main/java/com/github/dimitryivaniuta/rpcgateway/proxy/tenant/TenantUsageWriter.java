package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import com.github.dimitryivaniuta.rpcgateway.config.AsyncConfig;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.rpcgateway.proxy.support.TokenMasking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Write-behind persistence of tenant usage. One attempt per snapshot; failures are logged
 * and never reach the admission decision.
 */
@Slf4j
@Component
public class TenantUsageWriter {

    private final TenantAccountRepository repository;
    private final Executor executor;
    private final GatewayMetrics metrics;

    public TenantUsageWriter(TenantAccountRepository repository,
                             @Qualifier(AsyncConfig.USAGE_WRITER_EXECUTOR) Executor executor,
                             GatewayMetrics metrics) {
        this.repository = repository;
        this.executor = executor;
        this.metrics = metrics;
    }

    /** @return false when the write queue is full and the snapshot was dropped */
    public boolean submit(UsageSnapshot snapshot) {
        try {
            executor.execute(() -> write(snapshot));
            return true;
        } catch (RejectedExecutionException ex) {
            log.warn("Usage write queue full, dropping snapshot for tenant {}", TokenMasking.mask(snapshot.token()));
            metrics.usageWriteDropped();
            return false;
        }
    }

    void write(UsageSnapshot snapshot) {
        try {
            int updated = repository.updateUsage(snapshot.token(), snapshot.currentMonthRequests(), snapshot.monthResetAt());
            if (updated == 0) {
                log.debug("Stale usage snapshot ignored for tenant {}", TokenMasking.mask(snapshot.token()));
            }
        } catch (RuntimeException ex) {
            log.warn("Usage flush failed for tenant {}: {}", TokenMasking.mask(snapshot.token()), ex.getMessage());
            metrics.usageWriteFailed();
        }
    }
}
