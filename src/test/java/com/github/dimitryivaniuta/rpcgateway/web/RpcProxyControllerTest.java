package com.github.dimitryivaniuta.rpcgateway.web;

import com.github.dimitryivaniuta.rpcgateway.proxy.ErrorType;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayException;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcProxyResponse;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcRequestOrchestrator;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.ClientIpResolver;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.RateLimitExceededException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = RpcProxyController.class)
@Import({ClientIpResolver.class, GlobalExceptionHandler.class, CorrelationIdFilter.class})
class RpcProxyControllerTest {

    private static final String TOKEN = "Zm9vYmFyYmF6cXV4MTIzNDU2Nzg5MA";
    private static final String CALL = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_chainId\",\"params\":[]}";

    @Autowired
    MockMvc mvc;

    @MockBean
    RpcRequestOrchestrator orchestrator;

    @Test
    void rootAnswersAsJsonRpcHealthCheck() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jsonrpc").value("2.0"))
                .andExpect(jsonPath("$.result").value(true));
    }

    @Test
    void publicCallIsKeyedByForwardedClientAddress() throws Exception {
        when(orchestrator.handlePublic(eq("eth"), eq("198.51.100.7"), eq(HttpMethod.POST), any()))
                .thenReturn(new RpcProxyResponse(200,
                        Map.of("X-Rpc-Cache", "MISS"),
                        "{\"result\":\"0x1\"}".getBytes(StandardCharsets.UTF_8)));

        mvc.perform(post("/eth")
                        .header("X-Forwarded-For", "198.51.100.7, 10.0.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CALL))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Rpc-Cache", "MISS"))
                .andExpect(header().exists("X-Correlation-Id"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.result").value("0x1"));

        verify(orchestrator).handlePublic(eq("eth"), eq("198.51.100.7"), eq(HttpMethod.POST), any());
    }

    @Test
    void upstreamStatusIsPassedThrough() throws Exception {
        when(orchestrator.handleAuthenticated(eq("eth"), eq(TOKEN), eq(HttpMethod.POST), any()))
                .thenReturn(new RpcProxyResponse(502, Map.of(),
                        "{\"error\":\"Upstream error\",\"details\":\"timeout\"}".getBytes(StandardCharsets.UTF_8)));

        mvc.perform(post("/eth/{token}", TOKEN).contentType(MediaType.APPLICATION_JSON).content(CALL))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Upstream error"));
    }

    @Test
    void unknownTenantIs404WithMaskedPath() throws Exception {
        when(orchestrator.handleAuthenticated(eq("eth"), eq(TOKEN), any(), any()))
                .thenThrow(new RpcGatewayException(ErrorType.TENANT_NOT_FOUND));

        mvc.perform(post("/eth/{token}", TOKEN).contentType(MediaType.APPLICATION_JSON).content(CALL))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("tenant_not_found"))
                .andExpect(content().string(not(containsString(TOKEN))));
    }

    @Test
    void monthlyLimitIs402() throws Exception {
        when(orchestrator.handleAuthenticated(eq("eth"), eq(TOKEN), any(), any()))
                .thenThrow(new RpcGatewayException(ErrorType.MONTHLY_LIMIT_EXCEEDED));

        mvc.perform(post("/eth/{token}", TOKEN).contentType(MediaType.APPLICATION_JSON).content(CALL))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("monthly_limit_exceeded"));
    }

    @Test
    void rateLimitIs429WithRetryAfter() throws Exception {
        when(orchestrator.handlePublic(eq("eth"), any(), any(), any()))
                .thenThrow(new RateLimitExceededException("Rate Limit Exceeded", 1));

        mvc.perform(post("/eth").contentType(MediaType.APPLICATION_JSON).content(CALL))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.code").value("rate_limit_exceeded"));
    }

    @Test
    void unsupportedChainIs404() throws Exception {
        when(orchestrator.handlePublic(eq("dogechain"), any(), any(), any()))
                .thenThrow(new RpcGatewayException(ErrorType.CHAIN_NOT_SUPPORTED,
                        "Chain dogechain not supported or no nodes available"));

        mvc.perform(post("/dogechain").contentType(MediaType.APPLICATION_JSON).content(CALL))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("chain_not_supported"));
    }
}
