package com.example.brite.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Google Maps API 호출을 위한 WebClient 설정
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(2 * 1024 * 1024)); // 2MB
    }

    @Bean
    public WebClient googleMapsWebClient(WebClient.Builder builder, GoogleMapsProperties properties) {
        return builder
                .baseUrl(properties.getApiBaseUrl())
                .build();
    }
}
