package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RpcCachePolicyTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RpcCachePolicy policy = new RpcCachePolicy(new RpcGatewayProperties());

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s);
    }

    @ParameterizedTest
    @ValueSource(strings = {"eth_chainId", "net_version", "eth_getTransactionReceipt", "eth_getBlockByHash", "web3_sha3"})
    void immutableMethodsGetStaticTtl(String method) {
        assertThat(policy.classify(method, null)).isEqualTo(900);
    }

    @Test
    void blockByNumberDependsOnFirstArgument() throws Exception {
        assertThat(policy.classify("eth_getBlockByNumber", json("[\"0x10d4f\", false]"))).isEqualTo(900);
        assertThat(policy.classify("eth_getBlockByNumber", json("[\"latest\", false]"))).isEqualTo(3);
        assertThat(policy.classify("eth_getBlockByNumber", json("[]"))).isEqualTo(3);
    }

    @Test
    @DisplayName("fixed pointer is historical, moving tag is volatile, for state reads keyed by the last argument")
    void stateReadsUseLastArgument() throws Exception {
        assertThat(policy.classify("eth_getBalance", json("[\"0xabc\", \"0x1b4\"]"))).isEqualTo(300);
        assertThat(policy.classify("eth_getBalance", json("[\"0xabc\", \"latest\"]"))).isEqualTo(3);
        assertThat(policy.classify("eth_getStorageAt", json("[\"0xabc\", \"0x0\", \"pending\"]"))).isEqualTo(3);
        assertThat(policy.classify("eth_getProof", json("[\"0xabc\", [], \"0x1b4\"]"))).isEqualTo(300);
    }

    @Test
    void ethCallUsesSecondArgument() throws Exception {
        assertThat(policy.classify("eth_call", json("[{\"to\":\"0xabc\"}, \"0x1b4\"]"))).isEqualTo(300);
        assertThat(policy.classify("eth_call", json("[{\"to\":\"0xabc\"}, \"finalized\"]"))).isEqualTo(3);
        assertThat(policy.classify("eth_call", json("[{\"to\":\"0xabc\"}]"))).isEqualTo(3);
    }

    @Test
    void movingTagsAreCaseInsensitive() throws Exception {
        assertThat(policy.classify("eth_getBlockByNumber", json("[\"LATEST\", false]"))).isEqualTo(3);
        assertThat(RpcCachePolicy.isFixedBlockPointer(json("\"0xABC\""))).isTrue();
        assertThat(RpcCachePolicy.isFixedBlockPointer(json("123"))).isFalse();
    }

    @Test
    void uppercaseHexPrefixIsNotAFixedPointer() throws Exception {
        assertThat(RpcCachePolicy.isFixedBlockPointer(json("\"0X10d4f\""))).isFalse();
        assertThat(policy.classify("eth_getBlockByNumber", json("[\"0X10d4f\", false]"))).isEqualTo(3);
        assertThat(policy.classify("eth_getBalance", json("[\"0xabc\", \"0X10\"]"))).isEqualTo(3);
    }

    @Test
    void logsNeedBothBoundsFixed() throws Exception {
        assertThat(policy.classify("eth_getLogs", json("[{\"fromBlock\":\"0x1\",\"toBlock\":\"0x2\"}]"))).isEqualTo(300);
        assertThat(policy.classify("eth_getLogs", json("[{\"fromBlock\":\"0x1\",\"toBlock\":\"latest\"}]"))).isEqualTo(3);
        assertThat(policy.classify("eth_getLogs", json("[{\"fromBlock\":\"0x1\"}]"))).isEqualTo(3);
        assertThat(policy.classify("eth_getLogs", json("[\"not-an-object\"]"))).isZero();
        assertThat(policy.classify("eth_getLogs", null)).isZero();
    }

    @Test
    void shortFixedTtls() {
        assertThat(policy.classify("eth_blockNumber", null)).isEqualTo(3);
        assertThat(policy.classify("eth_estimateGas", null)).isEqualTo(3);
        assertThat(policy.classify("eth_syncing", null)).isEqualTo(5);
        assertThat(policy.classify("net_peerCount", null)).isEqualTo(10);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "eth_sendRawTransaction", "eth_getTransactionCount", "eth_newFilter", "eth_getFilterChanges",
            "eth_subscribe", "txpool_content", "debug_traceTransaction", "trace_block", "eth_callMany",
            "eth_somethingNew", "foo"})
    void neverCachedMethodsReturnZero(String method) throws Exception {
        assertThat(policy.classify(method, json("[\"0x1\"]"))).isZero();
    }

    @Test
    void classificationIsIdempotent() throws Exception {
        JsonNode params = json("[\"0xabc\", \"0x1b4\"]");
        long first = policy.classify("eth_getBalance", params);
        for (int i = 0; i < 10; i++) {
            assertThat(policy.classify("eth_getBalance", params)).isEqualTo(first);
        }
    }

    @Test
    void ttlsFollowConfiguration() {
        RpcGatewayProperties props = new RpcGatewayProperties();
        props.getCache().setStaticTtlSeconds(60);
        RpcCachePolicy custom = new RpcCachePolicy(props);

        assertThat(custom.classify("eth_chainId", null)).isEqualTo(60);
    }

    @Test
    void categoriesFollowTtlThresholds() {
        assertThat(policy.categoryOf(900)).isEqualTo(CacheCategory.STATIC);
        assertThat(policy.categoryOf(300)).isEqualTo(CacheCategory.STATIC);
        assertThat(policy.categoryOf(10)).isEqualTo(CacheCategory.VOLATILE);
        assertThat(policy.categoryOf(1)).isEqualTo(CacheCategory.DYNAMIC);
        assertThat(policy.categoryOf(0)).isEqualTo(CacheCategory.NEVER);
    }
}
