package com.github.dimitryivaniuta.rpcgateway.web;

import com.github.dimitryivaniuta.rpcgateway.proxy.dispatch.ChainNodes;
import com.github.dimitryivaniuta.rpcgateway.proxy.dispatch.NodePool;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Public directory of served chains. Only counts are exposed: node URLs may carry provider keys.
 */
@RestController
@RequiredArgsConstructor
public class ChainsController {

    private final NodePool nodePool;

    public record ChainStats(String slug, int nodes, int archiveNodes, int mevNodes) {}

    public record ChainDirectory(List<ChainStats> chains, int totalChains, int totalNodes, int totalArchiveNodes) {}

    @GetMapping(value = "/chains", produces = MediaType.APPLICATION_JSON_VALUE)
    public ChainDirectory chains() {
        List<ChainStats> chains = nodePool.chains().stream()
                .sorted()
                .map(slug -> nodePool.find(slug).map(nodes -> toStats(slug, nodes)))
                .flatMap(Optional::stream)
                .toList();
        return new ChainDirectory(
                chains,
                chains.size(),
                chains.stream().mapToInt(ChainStats::nodes).sum(),
                chains.stream().mapToInt(ChainStats::archiveNodes).sum());
    }

    private static ChainStats toStats(String slug, ChainNodes nodes) {
        return new ChainStats(slug, nodes.nodes().size(), nodes.archiveNodes().size(),
                nodes.protectedRelay() == null ? 0 : 1);
    }
}
