package com.realestate.spatial.infrastructure.external;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration shared by the geocoder and router clients.
 */
@Configuration
public class WebClientConfig {

    // full-overview routes across the country exceed the 256 KB default buffer
    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build());
    }
}
