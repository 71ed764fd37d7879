package com.github.dimitryivaniuta.rpcgateway.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.rpcgateway.proxy.cache.CacheKeyDeriver;
import com.github.dimitryivaniuta.rpcgateway.proxy.cache.CacheStatus;
import com.github.dimitryivaniuta.rpcgateway.proxy.cache.CachedRpcResponse;
import com.github.dimitryivaniuta.rpcgateway.proxy.cache.RpcCacheKey;
import com.github.dimitryivaniuta.rpcgateway.proxy.cache.RpcCachePolicy;
import com.github.dimitryivaniuta.rpcgateway.proxy.cache.RpcResponseCache;
import com.github.dimitryivaniuta.rpcgateway.proxy.dispatch.RpcDispatcher;
import com.github.dimitryivaniuta.rpcgateway.proxy.dispatch.UpstreamResponse;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.RequestEventPublisher;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.RpcRequestEvent;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.PublicRateLimiter;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.RateLimitExceededException;
import com.github.dimitryivaniuta.rpcgateway.proxy.tenant.AdmissionDecision;
import com.github.dimitryivaniuta.rpcgateway.proxy.tenant.DenialReason;
import com.github.dimitryivaniuta.rpcgateway.proxy.tenant.TenantAdmissionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RpcRequestOrchestratorTest {

    private static final String TOKEN = "tok_0123456789abcdef";

    @Mock
    TenantAdmissionService admissionService;
    @Mock
    PublicRateLimiter publicRateLimiter;
    @Mock
    RpcResponseCache responseCache;
    @Mock
    RpcDispatcher dispatcher;
    @Mock
    RequestEventPublisher eventPublisher;

    private final ObjectMapper mapper = new ObjectMapper();
    private RpcRequestOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new RpcRequestOrchestrator(
                admissionService,
                publicRateLimiter,
                new RpcCachePolicy(new RpcGatewayProperties()),
                new CacheKeyDeriver(mapper),
                responseCache,
                dispatcher,
                eventPublisher,
                new GatewayMetrics(new SimpleMeterRegistry()),
                mapper);
    }

    private static byte[] body(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    private static UpstreamResponse ok(String json) {
        return new UpstreamResponse(200, "application/json", body(json), false);
    }

    private RpcRequestEvent publishedEvent() {
        ArgumentCaptor<RpcRequestEvent> captor = ArgumentCaptor.forClass(RpcRequestEvent.class);
        verify(eventPublisher).publish(captor.capture());
        return captor.getValue();
    }

    @Test
    void missIsForwardedAndStoredAsynchronously() {
        byte[] req = body("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_chainId\",\"params\":[]}");
        when(admissionService.checkLimit(TOKEN)).thenReturn(AdmissionDecision.allow(99));
        when(responseCache.lookup(any(), eq(900L))).thenReturn(Optional.empty());
        when(dispatcher.forward("eth", "eth_chainId", HttpMethod.POST, req)).thenReturn(ok("{\"result\":\"0x1\"}"));

        RpcProxyResponse response = orchestrator.handleAuthenticated("eth", TOKEN, HttpMethod.POST, req);

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.headers()).containsEntry("X-Rpc-Cache", "MISS");
        verify(responseCache).store(any(RpcCacheKey.class), any(UpstreamResponse.class), eq(900L));

        RpcRequestEvent event = publishedEvent();
        assertThat(event.cacheStatus()).isEqualTo(CacheStatus.MISS);
        assertThat(event.userType()).isEqualTo(RpcRequestEvent.UserType.AUTHENTICATED);
        assertThat(event.errorType()).isNull();
        assertThat(event.toString()).doesNotContain(TOKEN);
    }

    @Test
    void hitIsServedWithoutUpstreamCall() {
        byte[] req = body("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"eth_getBlockByNumber\",\"params\":[\"0x10\",false]}");
        CachedRpcResponse cached = new CachedRpcResponse(200,
                Map.of("Content-Type", "application/json", "Cache-Control", "public, max-age=900"),
                body("{\"result\":{}}"), 900);
        when(responseCache.lookup(any(), eq(900L))).thenReturn(Optional.of(cached));

        RpcProxyResponse response = orchestrator.handlePublic("eth", "203.0.113.9", HttpMethod.POST, req);

        verify(publicRateLimiter).acquire("203.0.113.9");
        verify(dispatcher, never()).forward(any(), any(), any(), any());
        assertThat(response.headers())
                .containsEntry("X-Rpc-Cache", "HIT")
                .containsEntry("Cache-Control", "public, max-age=900");
        assertThat(publishedEvent().cacheStatus()).isEqualTo(CacheStatus.HIT);
    }

    @Test
    void nonCacheableMethodBypassesCache() {
        byte[] req = body("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_sendRawTransaction\",\"params\":[\"0xf86b\"]}");
        when(dispatcher.forward("eth", "eth_sendRawTransaction", HttpMethod.POST, req)).thenReturn(ok("{\"result\":\"0xhash\"}"));

        RpcProxyResponse response = orchestrator.handlePublic("eth", "203.0.113.9", HttpMethod.POST, req);

        verifyNoInteractions(responseCache);
        assertThat(response.headers()).doesNotContainKey("X-Rpc-Cache");
        assertThat(publishedEvent().cacheStatus()).isEqualTo(CacheStatus.BYPASS);
    }

    @Test
    void failedUpstreamAnswerIsNotStored() {
        byte[] req = body("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_blockNumber\"}");
        when(responseCache.lookup(any(), eq(3L))).thenReturn(Optional.empty());
        when(dispatcher.forward(eq("eth"), eq("eth_blockNumber"), any(), any()))
                .thenReturn(new UpstreamResponse(502, "application/json", body("{\"error\":\"Upstream error\"}"), true));

        RpcProxyResponse response = orchestrator.handlePublic("eth", "203.0.113.9", HttpMethod.POST, req);

        assertThat(response.status()).isEqualTo(502);
        verify(responseCache, never()).store(any(), any(), anyLong());
        assertThat(publishedEvent().errorType()).isEqualTo("upstream_error");
    }

    @Test
    @DisplayName("invalid JSON is still forwarded, uncached")
    void invalidJsonIsForwardedWithoutCaching() {
        byte[] req = body("{not json");
        when(dispatcher.forward(eq("eth"), isNull(), any(), any())).thenReturn(ok("{\"error\":{\"code\":-32700}}"));

        RpcProxyResponse response = orchestrator.handlePublic("eth", "203.0.113.9", HttpMethod.POST, req);

        assertThat(response.status()).isEqualTo(200);
        verifyNoInteractions(responseCache);
        RpcRequestEvent event = publishedEvent();
        assertThat(event.errorType()).isEqualTo("invalid_request_body");
        assertThat(event.cacheStatus()).isEqualTo(CacheStatus.NONE);
        assertThat(event.method()).isEqualTo("unknown");
    }

    @Test
    void batchBypassesCache() {
        byte[] req = body("[{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_chainId\"}]");
        when(dispatcher.forward(eq("eth"), eq("batch"), any(), any())).thenReturn(ok("[]"));

        orchestrator.handlePublic("eth", "203.0.113.9", HttpMethod.POST, req);

        verifyNoInteractions(responseCache);
        assertThat(publishedEvent().cacheStatus()).isEqualTo(CacheStatus.BYPASS);
    }

    @Test
    void denialsMapToTheirErrorTypes() {
        byte[] req = body("{\"method\":\"eth_chainId\"}");
        when(admissionService.checkLimit(TOKEN)).thenReturn(
                AdmissionDecision.deny(DenialReason.MONTHLY_LIMIT, 0),
                AdmissionDecision.deny(DenialReason.TENANT_NOT_FOUND, 0),
                AdmissionDecision.deny(DenialReason.RATE_LIMIT, 10));

        assertThatThrownBy(() -> orchestrator.handleAuthenticated("eth", TOKEN, HttpMethod.POST, req))
                .isInstanceOfSatisfying(RpcGatewayException.class,
                        ex -> assertThat(ex.getErrorType()).isEqualTo(ErrorType.MONTHLY_LIMIT_EXCEEDED));
        assertThatThrownBy(() -> orchestrator.handleAuthenticated("eth", TOKEN, HttpMethod.POST, req))
                .isInstanceOfSatisfying(RpcGatewayException.class,
                        ex -> assertThat(ex.getErrorType()).isEqualTo(ErrorType.TENANT_NOT_FOUND));
        assertThatThrownBy(() -> orchestrator.handleAuthenticated("eth", TOKEN, HttpMethod.POST, req))
                .isInstanceOfSatisfying(RateLimitExceededException.class,
                        ex -> assertThat(ex.getRetryAfterSeconds()).isEqualTo(1));

        verify(dispatcher, never()).forward(any(), any(), any(), any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void unsupportedChainIsRejectedBeforeAdmission() {
        when(dispatcher.requireChain("nope")).thenThrow(new RpcGatewayException(ErrorType.CHAIN_NOT_SUPPORTED));

        assertThatThrownBy(() -> orchestrator.handleAuthenticated("nope", TOKEN, HttpMethod.POST, body("{}")))
                .isInstanceOf(RpcGatewayException.class);

        verifyNoInteractions(admissionService);
    }
}
