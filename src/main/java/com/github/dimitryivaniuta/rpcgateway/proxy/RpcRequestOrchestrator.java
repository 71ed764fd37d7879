package com.github.dimitryivaniuta.rpcgateway.proxy;

import com.fasterxml.jackson.databind.JsonNode;
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
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.RpcRequestEvent.UserType;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.PublicRateLimiter;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.RateLimitExceededException;
import com.github.dimitryivaniuta.rpcgateway.proxy.tenant.AdmissionDecision;
import com.github.dimitryivaniuta.rpcgateway.proxy.tenant.TenantAdmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.github.dimitryivaniuta.rpcgateway.proxy.web.RequestContextKeys.CACHE_STATUS_HEADER;

/**
 * Per-call glue: admission, cache classification and lookup, dispatch, then the asynchronous
 * cache store and request event. Nothing after the upstream answer blocks the response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RpcRequestOrchestrator {

    private static final long TENANT_RETRY_AFTER_SECONDS = 1;

    private final TenantAdmissionService admissionService;
    private final PublicRateLimiter publicRateLimiter;
    private final RpcCachePolicy cachePolicy;
    private final CacheKeyDeriver keyDeriver;
    private final RpcResponseCache responseCache;
    private final RpcDispatcher dispatcher;
    private final RequestEventPublisher eventPublisher;
    private final GatewayMetrics metrics;
    private final ObjectMapper objectMapper;

    public RpcProxyResponse handlePublic(String chain, String clientAddress, HttpMethod httpMethod, byte[] body) {
        publicRateLimiter.acquire(clientAddress);
        return proxy(chain, httpMethod, body, UserType.PUBLIC);
    }

    public RpcProxyResponse handleAuthenticated(String chain, String token, HttpMethod httpMethod, byte[] body) {
        // unsupported chains are rejected before they can consume quota
        dispatcher.requireChain(chain);

        AdmissionDecision decision = admissionService.checkLimit(token);
        if (!decision.allowed()) {
            ErrorType type = decision.reason().errorType();
            if (type == ErrorType.RATE_LIMIT_EXCEEDED) {
                throw new RateLimitExceededException(type.defaultMessage(), TENANT_RETRY_AFTER_SECONDS);
            }
            throw new RpcGatewayException(type);
        }
        return proxy(chain, httpMethod, body, UserType.AUTHENTICATED);
    }

    private RpcProxyResponse proxy(String rawChain, HttpMethod httpMethod, byte[] body, UserType userType) {
        long started = System.nanoTime();
        dispatcher.requireChain(rawChain);
        String chain = rawChain.trim().toLowerCase(Locale.ROOT);

        ParsedCall call = parse(body);
        CacheStatus cacheStatus = CacheStatus.NONE;
        String errorType = call.errorType();
        long ttl = 0;
        RpcCacheKey key = null;

        if (call.method() != null) {
            ttl = call.batch() ? 0 : cachePolicy.classify(call.method(), call.params());
            if (ttl > 0) {
                key = keyDeriver.deriveKey(chain, call.method(), call.params());
                Optional<CachedRpcResponse> hit = responseCache.lookup(key, ttl);
                metrics.cacheLookup(chain, cachePolicy.categoryOf(ttl).tag(), hit.isPresent());
                if (hit.isPresent()) {
                    CachedRpcResponse cached = hit.get();
                    Map<String, String> headers = new LinkedHashMap<>(cached.headers());
                    headers.put(CACHE_STATUS_HEADER, CacheStatus.HIT.name());
                    publish(chain, call, CacheStatus.HIT, userType, cached.status(), started,
                            body, cached.body(), null);
                    return new RpcProxyResponse(cached.status(), headers, cached.body());
                }
                cacheStatus = CacheStatus.MISS;
            } else {
                cacheStatus = CacheStatus.BYPASS;
            }
        }

        UpstreamResponse upstream = dispatcher.forward(chain, call.method(), httpMethod, body);

        if (key != null && upstream.cacheable()) {
            responseCache.store(key, upstream, ttl);
        }

        if (upstream.transportFailure()) {
            errorType = ErrorType.UPSTREAM_ERROR.code();
        } else if (!upstream.isSuccessful()) {
            errorType = "upstream_" + upstream.status();
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (upstream.contentType() != null) {
            headers.put(HttpHeaders.CONTENT_TYPE, upstream.contentType());
        }
        if (cacheStatus.exposedInHeader()) {
            headers.put(CACHE_STATUS_HEADER, cacheStatus.name());
        }

        publish(chain, call, cacheStatus, userType, upstream.status(), started, body, upstream.body(), errorType);
        return new RpcProxyResponse(upstream.status(), headers, upstream.body());
    }

    /** Invalid JSON is not an error: the call is forwarded uncached. */
    ParsedCall parse(byte[] body) {
        if (body == null || body.length == 0) {
            return ParsedCall.NONE;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException ex) {
            log.debug("Request body is not valid JSON: {}", ex.getMessage());
            return new ParsedCall(null, null, false, ErrorType.INVALID_REQUEST_BODY.code());
        }
        if (root == null || root.isMissingNode()) {
            return ParsedCall.NONE;
        }
        if (root.isArray()) {
            return new ParsedCall("batch", null, true, null);
        }
        JsonNode method = root.get("method");
        if (method == null || !method.isTextual()) {
            return ParsedCall.NONE;
        }
        return new ParsedCall(method.asText(), root.get("params"), false, null);
    }

    private void publish(String chain, ParsedCall call, CacheStatus cacheStatus, UserType userType,
                         int status, long startedNanos, byte[] request, byte[] response, String errorType) {
        try {
            eventPublisher.publish(new RpcRequestEvent(
                    chain,
                    call.method() == null ? "unknown" : call.method(),
                    cacheStatus,
                    userType,
                    status,
                    (System.nanoTime() - startedNanos) / 1_000_000,
                    request == null ? 0 : request.length,
                    response == null ? 0 : response.length,
                    errorType));
        } catch (RuntimeException ex) {
            log.warn("Request event dropped: {}", ex.getMessage());
        }
    }

    record ParsedCall(String method, JsonNode params, boolean batch, String errorType) {
        static final ParsedCall NONE = new ParsedCall(null, null, false, null);
    }
}
