package com.github.dimitryivaniuta.rpcgateway.proxy;

import java.util.Map;

/** What the web layer writes back: status, the few headers we expose, and the raw body. */
public record RpcProxyResponse(int status, Map<String, String> headers, byte[] body) {}
