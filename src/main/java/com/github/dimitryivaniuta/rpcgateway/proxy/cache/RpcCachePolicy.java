package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.ToLongFunction;

/**
 * Decides how long the response to a JSON-RPC call may be cached.
 *
 * <p>The answer depends on the method and, for block-scoped reads, on whether the block
 * reference is a fixed pointer ({@code 0x...}) or a moving tag ({@code latest}, {@code pending}...).
 * Data addressed by a fixed pointer cannot change, so it gets a long TTL; data at a moving tag
 * gets the volatile TTL. Unknown methods, writes, filters and traces are never cached.
 *
 * <p>Pure function of its inputs; safe for concurrent use.
 */
@Component
public class RpcCachePolicy {

    private static final Set<String> MOVING_TAGS = Set.of("latest", "earliest", "pending", "safe", "finalized");

    private final long staticTtl;
    private final long historicalTtl;
    private final long volatileTtl;
    private final Map<String, ToLongFunction<JsonNode>> rules;

    public RpcCachePolicy(RpcGatewayProperties props) {
        RpcGatewayProperties.Cache ttl = props.getCache();
        this.staticTtl = ttl.getStaticTtlSeconds();
        this.historicalTtl = ttl.getHistoricalTtlSeconds();
        this.volatileTtl = ttl.getVolatileTtlSeconds();
        this.rules = buildRules(ttl);
    }

    /** @return TTL in seconds; 0 means never cache */
    public long classify(String method, JsonNode params) {
        if (method == null) return 0;
        ToLongFunction<JsonNode> rule = rules.get(method);
        return rule == null ? 0 : rule.applyAsLong(params);
    }

    public CacheCategory category(String method, JsonNode params) {
        return categoryOf(classify(method, params));
    }

    public CacheCategory categoryOf(long ttlSeconds) {
        return CacheCategory.of(ttlSeconds, historicalTtl, volatileTtl);
    }

    /** A string starting with a lowercase {@code 0x} that is not a reserved moving tag. */
    static boolean isFixedBlockPointer(JsonNode ref) {
        if (ref == null || !ref.isTextual()) return false;
        String v = ref.asText();
        return v.startsWith("0x") && !MOVING_TAGS.contains(v.toLowerCase(Locale.ROOT));
    }

    private Map<String, ToLongFunction<JsonNode>> buildRules(RpcGatewayProperties.Cache ttl) {
        Map<String, ToLongFunction<JsonNode>> r = new HashMap<>();

        // addressed by hash or otherwise immutable
        fixed(r, staticTtl,
                "eth_chainId", "net_version", "web3_clientVersion",
                "eth_getTransactionByHash", "eth_getRawTransactionByHash", "eth_getTransactionReceipt",
                "eth_getBlockByHash", "eth_getBlockReceipts", "eth_getBlockTransactionCountByHash",
                "eth_getUncleCountByBlockHash", "eth_getTransactionByBlockHashAndIndex", "web3_sha3");

        // block reference in the first argument
        for (String m : new String[]{
                "eth_getBlockByNumber", "eth_getBlockTransactionCountByNumber",
                "eth_getUncleCountByBlockNumber", "eth_getTransactionByBlockNumberAndIndex"}) {
            r.put(m, params -> isFixedBlockPointer(arg(params, 0)) ? staticTtl : volatileTtl);
        }

        // state reads: block reference in the last argument
        for (String m : new String[]{"eth_getBalance", "eth_getCode", "eth_getStorageAt", "eth_getProof"}) {
            r.put(m, params -> isFixedBlockPointer(lastArg(params)) ? historicalTtl : volatileTtl);
        }

        r.put("eth_call", params -> isFixedBlockPointer(arg(params, 1)) ? historicalTtl : volatileTtl);
        r.put("eth_getLogs", this::logsTtl);

        fixed(r, volatileTtl,
                "eth_blockNumber", "eth_gasPrice", "eth_maxPriorityFeePerGas",
                "eth_feeHistory", "eth_blobBaseFee", "eth_estimateGas");
        fixed(r, ttl.getSyncingTtlSeconds(), "eth_syncing");
        fixed(r, ttl.getSlowTtlSeconds(), "eth_mining", "eth_hashrate", "net_listening", "net_peerCount");

        // listed for readability; absent methods also resolve to 0
        fixed(r, 0,
                "eth_getTransactionCount", "eth_accounts",
                "eth_newFilter", "eth_newBlockFilter", "eth_newPendingTransactionFilter",
                "eth_getFilterChanges", "eth_getFilterLogs", "eth_uninstallFilter",
                "eth_subscribe", "eth_unsubscribe",
                "eth_sendRawTransaction", "eth_sendTransaction", "eth_signTransaction", "eth_sign",
                "txpool_status", "txpool_content", "txpool_inspect", "txpool_contentFrom",
                "debug_traceTransaction", "debug_traceBlockByHash", "debug_traceBlockByNumber",
                "debug_getBadBlocks", "trace_block", "trace_transaction", "trace_call",
                "eth_simulateV1", "eth_callMany");

        return Map.copyOf(r);
    }

    private long logsTtl(JsonNode params) {
        JsonNode filter = arg(params, 0);
        if (filter == null || !filter.isObject()) return 0;
        boolean fixedRange = isFixedBlockPointer(filter.get("fromBlock"))
                && isFixedBlockPointer(filter.get("toBlock"));
        return fixedRange ? historicalTtl : volatileTtl;
    }

    private static void fixed(Map<String, ToLongFunction<JsonNode>> r, long ttl, String... methods) {
        for (String m : methods) {
            r.put(m, params -> ttl);
        }
    }

    private static JsonNode arg(JsonNode params, int index) {
        if (params == null || !params.isArray() || params.size() <= index) return null;
        return params.get(index);
    }

    private static JsonNode lastArg(JsonNode params) {
        if (params == null || !params.isArray() || params.isEmpty()) return null;
        return params.get(params.size() - 1);
    }
}
