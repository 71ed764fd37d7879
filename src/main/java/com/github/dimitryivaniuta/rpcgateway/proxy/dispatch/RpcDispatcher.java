package com.github.dimitryivaniuta.rpcgateway.proxy.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.rpcgateway.proxy.ErrorType;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayException;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import com.github.dimitryivaniuta.rpcgateway.proxy.metrics.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Forwards a JSON-RPC call to one upstream of the requested chain.
 *
 * <p>Node choice is round-robin, except that {@code eth_sendRawTransaction} always goes to the chain's
 * protected relay when one is configured, and {@code debug_*}/{@code trace_*} prefer archive nodes.
 * Inbound headers are never forwarded. Each call makes exactly one attempt: a transport failure
 * becomes a synthesized 502, and any upstream status is passed through unchanged.
 */
@Slf4j
@Component
public class RpcDispatcher {

    public static final String SEND_RAW_TRANSACTION = "eth_sendRawTransaction";

    private static final Pattern URL_PATTERN = Pattern.compile("(?i)\\b[a-z][a-z0-9+.-]*://[^\\s\"']+");

    private final NodePool nodePool;
    private final RoundRobinNodeSelector selector;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final GatewayMetrics metrics;
    private final String serviceAuthHeader;
    private final String serviceAuthValue;

    public RpcDispatcher(NodePool nodePool,
                         RoundRobinNodeSelector selector,
                         @Qualifier("upstreamRestClient") RestClient restClient,
                         ObjectMapper objectMapper,
                         GatewayMetrics metrics,
                         RpcGatewayProperties props) {
        this.nodePool = nodePool;
        this.selector = selector;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.serviceAuthHeader = props.getUpstream().getServiceAuthHeader();
        this.serviceAuthValue = props.getUpstream().getServiceAuthValue();
    }

    /** @throws RpcGatewayException with {@link ErrorType#CHAIN_NOT_SUPPORTED} for an unknown or empty chain */
    public ChainNodes requireChain(String chain) {
        return nodePool.find(chain)
                .filter(ChainNodes::hasNodes)
                .orElseThrow(() -> new RpcGatewayException(ErrorType.CHAIN_NOT_SUPPORTED,
                        "Chain " + chain + " not supported or no nodes available"));
    }

    public UpstreamResponse forward(String chain, String method, HttpMethod httpMethod, byte[] body) {
        String target = selectTarget(method, requireChain(chain));
        try {
            UpstreamResponse response = restClient.method(httpMethod)
                    .uri(URI.create(target))
                    .headers(this::upstreamHeaders)
                    .body(body == null ? new byte[0] : body)
                    .exchange((req, res) -> new UpstreamResponse(
                            res.getStatusCode().value(),
                            res.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE),
                            res.getBody().readAllBytes(),
                            false));
            metrics.upstreamResponse(chain, response.status());
            return response;
        } catch (RestClientException ex) {
            String details = failureDetails(ex);
            log.warn("Upstream call to {} failed for chain {}: {}", hostOf(target), chain, details);
            metrics.upstreamFailure(chain);
            return transportFailure(details);
        }
    }

    String selectTarget(String method, ChainNodes nodes) {
        if (SEND_RAW_TRANSACTION.equals(method) && nodes.protectedRelay() != null) {
            return nodes.protectedRelay();
        }
        List<String> candidates = nodes.nodes();
        if (method != null && !nodes.archiveNodes().isEmpty()
                && (method.startsWith("debug_") || method.startsWith("trace_"))) {
            candidates = nodes.archiveNodes();
        }
        return selector.select(candidates);
    }

    private void upstreamHeaders(HttpHeaders h) {
        h.setContentType(MediaType.APPLICATION_JSON);
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (serviceAuthValue != null && !serviceAuthValue.isBlank()) {
            h.set(serviceAuthHeader, serviceAuthValue);
        }
    }

    private UpstreamResponse transportFailure(String details) {
        String json = objectMapper.createObjectNode()
                .put("error", ErrorType.UPSTREAM_ERROR.defaultMessage())
                .put("details", details == null ? "unknown" : details)
                .toString();
        return new UpstreamResponse(ErrorType.UPSTREAM_ERROR.status().value(),
                MediaType.APPLICATION_JSON_VALUE, json.getBytes(StandardCharsets.UTF_8), true);
    }

    /**
     * Names the root cause only. Spring's own messages quote the request URL, and node URLs may
     * carry provider API keys, so any URL left in the cause message is blanked as well.
     */
    static String failureDetails(Throwable ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + ": " + URL_PATTERN.matcher(message).replaceAll("<upstream>");
    }

    // node URLs may embed provider API keys; log the host only
    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? "<unknown>" : host;
        } catch (IllegalArgumentException ex) {
            return "<invalid>";
        }
    }
}
