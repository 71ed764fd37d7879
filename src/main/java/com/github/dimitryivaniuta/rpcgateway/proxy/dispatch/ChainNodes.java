package com.github.dimitryivaniuta.rpcgateway.proxy.dispatch;

import java.util.List;

/**
 * Upstreams of one chain. {@code archiveNodes} may be empty; {@code protectedRelay} may be null.
 */
public record ChainNodes(List<String> nodes, List<String> archiveNodes, String protectedRelay) {

    public ChainNodes {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        archiveNodes = archiveNodes == null ? List.of() : List.copyOf(archiveNodes);
        protectedRelay = (protectedRelay == null || protectedRelay.isBlank()) ? null : protectedRelay.trim();
    }

    public boolean hasNodes() {
        return !nodes.isEmpty();
    }
}
