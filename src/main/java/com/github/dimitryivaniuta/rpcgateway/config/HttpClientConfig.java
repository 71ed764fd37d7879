package com.github.dimitryivaniuta.rpcgateway.config;

import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * Upstream HTTP client. Both timeouts are mandatory: a hung node must not hold a request thread.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient upstreamRestClient(RestClient.Builder builder, RpcGatewayProperties props) {
        RpcGatewayProperties.Upstream cfg = props.getUpstream();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(cfg.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(cfg.getReadTimeout());

        return builder.requestFactory(factory).build();
    }
}
