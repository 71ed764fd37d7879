package com.github.dimitryivaniuta.rpcgateway.proxy;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "rpc-gateway")
public class RpcGatewayProperties {

    private Admission admission = new Admission();
    private Cache cache = new Cache();
    private Upstream upstream = new Upstream();
    private PublicLimit publicLimit = new PublicLimit();
    private Executors executors = new Executors();

    /** Node pools keyed by chain slug ("eth", "base", ...). */
    private Map<String, Chain> chains = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Admission {
        /** Bucket capacity as a multiple of the plan's sustained rate. */
        private double burstMultiplier = 1.5;
        /** Zone used to decide calendar-month rollover. */
        private String monthZone = "UTC";
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);
        private long maxSessions = 100_000;
    }

    @Getter
    @Setter
    public static class Cache {
        private long staticTtlSeconds = 900;
        private long historicalTtlSeconds = 300;
        private long volatileTtlSeconds = 3;
        private long syncingTtlSeconds = 5;
        private long slowTtlSeconds = 10;
        private long maxEntries = 50_000;
    }

    @Getter
    @Setter
    public static class Upstream {
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(15);
        private String serviceAuthHeader = "X-Rpc-Gateway-Auth";
        /** Sent to upstreams when set; blank disables the header. */
        private String serviceAuthValue = "";
    }

    @Getter
    @Setter
    public static class PublicLimit {
        private boolean enabled = true;
        private int requestsPerSecond = 20;
        private long maxTrackedClients = 100_000;
    }

    @Getter
    @Setter
    public static class Executors {
        private int cacheWriterThreads = 2;
        private int usageWriterThreads = 2;
        private int eventThreads = 1;
        private int queueCapacity = 10_000;
    }

    @Getter
    @Setter
    public static class Chain {
        private List<String> nodes = new ArrayList<>();
        private List<String> archiveNodes = new ArrayList<>();
        private String protectedRelay;
    }
}
