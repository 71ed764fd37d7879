package com.github.dimitryivaniuta.rpcgateway.proxy.dispatch;

import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Node pool seeded from {@code rpc-gateway.chains}. Chain slugs are matched case-insensitively.
 */
@Slf4j
@Component
public class InMemoryNodePool implements NodePool {

    private final Map<String, ChainNodes> pool = new ConcurrentHashMap<>();

    public InMemoryNodePool(RpcGatewayProperties props) {
        props.getChains().forEach((slug, chain) -> replace(slug,
                new ChainNodes(chain.getNodes(), chain.getArchiveNodes(), chain.getProtectedRelay())));
        log.info("Node pool initialized for chains {}", pool.keySet());
    }

    @Override
    public Optional<ChainNodes> find(String chain) {
        if (chain == null) return Optional.empty();
        return Optional.ofNullable(pool.get(normalize(chain)));
    }

    @Override
    public Set<String> chains() {
        return Set.copyOf(pool.keySet());
    }

    @Override
    public void replace(String chain, ChainNodes nodes) {
        if (chain == null || chain.isBlank()) {
            throw new IllegalArgumentException("chain must not be blank");
        }
        if (nodes == null) {
            pool.remove(normalize(chain));
            return;
        }
        pool.put(normalize(chain), nodes);
    }

    private static String normalize(String chain) {
        return chain.trim().toLowerCase(Locale.ROOT);
    }
}
