package com.github.dimitryivaniuta.rpcgateway.web;

import com.github.dimitryivaniuta.rpcgateway.proxy.RpcProxyResponse;
import com.github.dimitryivaniuta.rpcgateway.proxy.RpcRequestOrchestrator;
import com.github.dimitryivaniuta.rpcgateway.proxy.ratelimit.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-RPC entry points. Bodies are proxied as raw bytes; only the chain slug and the bearer
 * token come from the path.
 */
@RestController
@RequiredArgsConstructor
public class RpcProxyController {

    private final RpcRequestOrchestrator orchestrator;
    private final ClientIpResolver clientIpResolver;

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", 1);
        body.put("jsonrpc", "2.0");
        body.put("result", true);
        return body;
    }

    @PostMapping("/{chain}")
    public ResponseEntity<byte[]> publicRpc(@PathVariable String chain,
                                            @RequestBody(required = false) byte[] body,
                                            HttpServletRequest request) {
        String clientAddress = clientIpResolver.resolve(request);
        return toEntity(orchestrator.handlePublic(chain, clientAddress, HttpMethod.POST, body));
    }

    @PostMapping("/{chain}/{token}")
    public ResponseEntity<byte[]> authenticatedRpc(@PathVariable String chain,
                                                   @PathVariable String token,
                                                   @RequestBody(required = false) byte[] body) {
        return toEntity(orchestrator.handleAuthenticated(chain, token, HttpMethod.POST, body));
    }

    private static ResponseEntity<byte[]> toEntity(RpcProxyResponse response) {
        HttpHeaders headers = new HttpHeaders();
        response.headers().forEach(headers::set);
        if (headers.getContentType() == null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return ResponseEntity.status(response.status()).headers(headers).body(response.body());
    }
}
