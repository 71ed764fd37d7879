package com.github.dimitryivaniuta.rpcgateway;

import com.github.dimitryivaniuta.rpcgateway.proxy.RpcGatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(RpcGatewayProperties.class)
public class RpcGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RpcGatewayApplication.class, args);
    }
}
