package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically evicts idle tenant actors; eviction flushes their pending usage.
 */
@Component
@RequiredArgsConstructor
public class TenantSessionSweepJob {

    private static final Logger log = LoggerFactory.getLogger(TenantSessionSweepJob.class);

    private final TenantAdmissionService admissionService;

    @Scheduled(cron = "0 * * * * *") // every minute
    public void sweepIdleSessions() {
        long before = admissionService.activeSessions();
        admissionService.sweep();
        long evicted = before - admissionService.activeSessions();
        if (evicted > 0) {
            log.info("Tenant session sweep evicted {} idle sessions", evicted);
        }
    }
}
