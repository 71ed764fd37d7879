package com.github.dimitryivaniuta.rpcgateway.proxy.dispatch;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over a node list with one process-wide counter shared by all chains.
 * The counter may wrap; {@link Math#floorMod} keeps the index in range.
 */
@Component
public class RoundRobinNodeSelector {

    private final AtomicInteger index;

    public RoundRobinNodeSelector() {
        this(0);
    }

    RoundRobinNodeSelector(int start) {
        this.index = new AtomicInteger(start);
    }

    public String select(List<String> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("At least one node required");
        }
        return nodes.get(Math.floorMod(index.getAndIncrement(), nodes.size()));
    }
}
