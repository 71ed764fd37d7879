package com.github.dimitryivaniuta.rpcgateway.proxy.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;

/**
 * Derives deterministic cache keys from (chain, method, params).
 *
 * <p>The request id and {@code jsonrpc} version are not part of the key; missing params hash
 * like an empty array. Object keys are sorted at every depth before hashing, so two requests
 * that differ only in key order share an entry.
 */
@Component
public class CacheKeyDeriver {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    public CacheKeyDeriver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RpcCacheKey deriveKey(String chain, String method, JsonNode params) {
        ObjectNode canonical = NODES.objectNode();
        canonical.put("method", method);
        canonical.set("params", (params == null || params.isNull()) ? NODES.arrayNode() : canonicalize(params));

        try {
            byte[] bytes = objectMapper.writeValueAsBytes(canonical);
            return new RpcCacheKey(chain, HexFormat.of().formatHex(sha256(bytes)));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize cache key input", ex);
        }
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = NODES.objectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode(node.size());
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                copy.add(canonicalize(it.next()));
            }
            return copy;
        }
        return node;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
