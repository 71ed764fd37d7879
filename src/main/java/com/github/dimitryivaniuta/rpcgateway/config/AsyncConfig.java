package com.github.dimitryivaniuta.rpcgateway.config;

import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Named, bounded pools for work that must never block the response path:
 * rpc-cache-writer, tenant-usage-writer and rpc-events.
 * A full queue rejects the task; callers log and drop it.
 */
@Configuration
public class AsyncConfig {

    public static final String CACHE_WRITER_EXECUTOR = "rpc-cache-writer";
    public static final String USAGE_WRITER_EXECUTOR = "tenant-usage-writer";
    public static final String EVENT_EXECUTOR = "rpc-events";

    @Bean(name = CACHE_WRITER_EXECUTOR)
    public Executor cacheWriterExecutor(RpcGatewayProperties props) {
        RpcGatewayProperties.Executors cfg = props.getExecutors();
        return bounded("rpc-cache-writer-", cfg.getCacheWriterThreads(), cfg.getQueueCapacity());
    }

    @Bean(name = USAGE_WRITER_EXECUTOR)
    public Executor usageWriterExecutor(RpcGatewayProperties props) {
        RpcGatewayProperties.Executors cfg = props.getExecutors();
        return bounded("tenant-usage-writer-", cfg.getUsageWriterThreads(), cfg.getQueueCapacity());
    }

    @Bean(name = EVENT_EXECUTOR)
    public Executor eventExecutor(RpcGatewayProperties props) {
        RpcGatewayProperties.Executors cfg = props.getExecutors();
        return bounded("rpc-events-", cfg.getEventThreads(), cfg.getQueueCapacity());
    }

    /** Wall clock for admission; tests substitute a fixed or manual one. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadPoolTaskExecutor bounded(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, threads));
        e.setMaxPoolSize(Math.max(1, threads));
        e.setQueueCapacity(Math.max(1, queueCapacity));
        e.setThreadNamePrefix(prefix);
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(5);
        e.initialize();
        return e;
    }
}
