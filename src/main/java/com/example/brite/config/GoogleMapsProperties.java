package com.example.brite.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Google Maps (Places / Geocoding) API 설정 프로퍼티
 */
@Component
@Getter
@Setter
@ConfigurationProperties(prefix = "google.maps")
public class GoogleMapsProperties {

    private String apiKey;
    private String apiBaseUrl = "https://maps.googleapis.com";
    private Duration timeout = Duration.ofSeconds(10);
    private int defaultRadius = 5000; // 미터
    private int maxResults = 10;
}
