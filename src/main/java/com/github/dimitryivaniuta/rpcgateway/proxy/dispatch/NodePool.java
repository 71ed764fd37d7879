package com.github.dimitryivaniuta.rpcgateway.proxy.dispatch;

import java.util.Optional;
import java.util.Set;

/**
 * Read side of the per-chain node pool. An external health prober publishes fresh lists
 * through {@link #replace}; the dispatcher only reads.
 */
public interface NodePool {

    Optional<ChainNodes> find(String chain);

    Set<String> chains();

    /** Atomically swaps the node set of one chain. */
    void replace(String chain, ChainNodes nodes);
}
