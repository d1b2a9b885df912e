package com.pmstax.config;

import com.pmstax.gateway.InMemoryTaxComponentGateway;
import com.pmstax.gateway.RestTaxComponentGateway;
import com.pmstax.gateway.TaxComponentGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Creates the {@link TaxComponentGateway} selected by {@code pmstax.gateway.mode}.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public TaxComponentGateway taxComponentGateway(GatewayProperties properties, RestTemplateBuilder builder) {
        return switch (properties.getMode()) {
            case REST -> {
                log.info("Using taxation API at {}", properties.getBaseUrl());
                RestTemplate restTemplate = builder
                        .setConnectTimeout(properties.getConnectTimeout())
                        .setReadTimeout(properties.getReadTimeout())
                        .build();
                yield new RestTaxComponentGateway(restTemplate, properties.getBaseUrl());
            }
            case IN_MEMORY -> {
                log.info("Using in-memory tax component store");
                yield new InMemoryTaxComponentGateway();
            }
        };
    }
}
