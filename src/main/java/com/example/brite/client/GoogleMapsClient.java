package com.example.brite.client;

import com.example.brite.config.GoogleMapsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

import static com.example.brite.google.constants.GoogleMapsApiConstants.GEOCODE_PATH;
import static com.example.brite.google.constants.GoogleMapsApiConstants.TEXT_SEARCH_PATH;

/**
 * Google Maps Places / Geocoding API 클라이언트
 * <p>
 * API 문서: https://developers.google.com/maps/documentation/places/web-service/search-text
 */
@Slf4j
@Component
public class GoogleMapsClient {

    private final WebClient webClient;
    private final GoogleMapsProperties properties;

    public GoogleMapsClient(@Qualifier("googleMapsWebClient") WebClient webClient,
                            GoogleMapsProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * 이름으로 장소 검색 (Places Text Search)
     *
     * @param query    검색어 (매장명)
     * @param location 검색 중심 좌표 "lat,lng" (선택)
     * @param radius   검색 반경 (미터, location이 있을 때만 사용)
     * @return 원본 응답 (status, results)
     */
    public Mono<Map<String, Object>> textSearch(String query, String location, int radius) {
        log.debug("Places 텍스트 검색 요청: query={}, location={}, radius={}", query, location, radius);

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(TEXT_SEARCH_PATH)
                            .queryParam("query", query)
                            .queryParam("key", properties.getApiKey());
                    if (location != null && !location.isBlank()) {
                        uriBuilder.queryParam("location", location)
                                .queryParam("radius", radius);
                    }
                    return uriBuilder.build();
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {
                })
                .doOnSuccess(response -> log.debug("Places 텍스트 검색 응답: status={}",
                        response != null ? response.get("status") : null))
                .doOnError(error -> logError("Places 텍스트 검색 실패", error));
    }

    /**
     * 주소로 좌표/장소 ID 조회 (Geocoding)
     *
     * @param address 주소
     * @return 원본 응답 (status, results)
     */
    public Mono<Map<String, Object>> geocode(String address) {
        log.debug("Geocoding 요청: address={}", address);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(GEOCODE_PATH)
                        .queryParam("address", address)
                        .queryParam("key", properties.getApiKey())
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {
                })
                .doOnSuccess(response -> log.debug("Geocoding 응답: status={}",
                        response != null ? response.get("status") : null))
                .doOnError(error -> logError("Geocoding 실패", error));
    }

    private void logError(String message, Throwable error) {
        if (error instanceof WebClientResponseException ex) {
            // 요청 URI에 API 키가 포함되므로 URI는 남기지 않음
            log.error("{}: status={}, body={}", message, ex.getStatusCode(), ex.getResponseBodyAsString());
        } else {
            log.error("{}: {}", message, error.toString());
        }
    }
}
