package com.github.dimitryivaniuta.rpcgateway.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Browser wallets and dApps call the RPC routes directly, so those accept any origin.
 * The admin API is not exposed cross-origin.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private static final String[] RPC_PATTERNS = {"/", "/*", "/*/*"};

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        for (String pattern : RPC_PATTERNS) {
            registry.addMapping(pattern)
                    .allowedOriginPatterns("*")
                    .allowedMethods("GET", "POST", "OPTIONS")
                    .allowedHeaders("Content-Type", "X-Correlation-Id")
                    .exposedHeaders("Retry-After", "X-Correlation-Id", "X-Rpc-Cache")
                    .allowCredentials(false)
                    .maxAge(3600L);
        }
    }
}
