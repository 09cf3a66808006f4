package com.example.brite.google.service;

import com.example.brite.client.GoogleMapsClient;
import com.example.brite.config.GoogleMapsProperties;
import com.example.brite.constants.ApiMessages;
import com.example.brite.dto.PlaceCandidate;
import com.example.brite.dto.PlaceQuery;
import com.example.brite.exception.GatewayException;
import com.example.brite.exception.ValidationException;
import com.example.brite.google.constants.GoogleMapsApiConstants.Field;
import com.example.brite.google.constants.GoogleMapsApiConstants.Status;
import com.example.brite.platform.PlaceLookupGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static com.example.brite.google.constants.GoogleMapsApiConstants.ADDRESS_NOT_AVAILABLE;

/**
 * Google Maps 기반 장소 검색
 * <p>
 * 이름 검색은 Places Text Search, 주소 검색은 Geocoding API를 사용합니다.
 * Google은 오류도 HTTP 200 + status 필드로 돌려주므로 status를 직접 해석합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GooglePlaceLookupService implements PlaceLookupGateway {

    private final GoogleMapsClient googleMapsClient;
    private final GoogleMapsProperties properties;

    @Override
    public List<PlaceCandidate> search(PlaceQuery query) {
        if (query == null || (!query.hasName() && !query.hasAddress())) {
            throw new ValidationException(ApiMessages.SEARCH_QUERY_REQUIRED);
        }
        if (query.hasName() && query.hasAddress()) {
            throw new ValidationException(ApiMessages.SEARCH_QUERY_AMBIGUOUS);
        }
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw GatewayException.unavailable("Google Maps API key is not configured", null);
        }

        if (query.hasName()) {
            int radius = query.getRadius() != null && query.getRadius() > 0
                    ? query.getRadius() : properties.getDefaultRadius();
            Map<String, Object> response = execute(
                    googleMapsClient.textSearch(query.getName().trim(), query.getLocation(), radius));
            List<PlaceCandidate> candidates = toCandidates(response, true);
            log.info("매장 이름 검색: name={}, 결과 {}건", query.getName(), candidates.size());
            return candidates;
        }

        Map<String, Object> response = execute(googleMapsClient.geocode(query.getAddress().trim()));
        List<PlaceCandidate> candidates = toCandidates(response, false);
        log.info("매장 주소 검색: address={}, 결과 {}건", query.getAddress(), candidates.size());
        return candidates;
    }

    /**
     * 설정된 타임아웃으로 동기 호출
     * HTTP 4xx는 요청 거절(400), 5xx/네트워크 오류/타임아웃은 업스트림 장애(502)로 변환
     */
    private Map<String, Object> execute(Mono<Map<String, Object>> call) {
        try {
            return call.timeout(properties.getTimeout()).block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is4xxClientError()) {
                throw GatewayException.rejected("Search parameter error: " + e.getStatusText());
            }
            throw GatewayException.unavailable("Place lookup service error: " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw GatewayException.unavailable("Place lookup service is unreachable", e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("장소 검색 타임아웃: timeout={}", properties.getTimeout());
                throw GatewayException.unavailable("Place lookup service timed out", e);
            }
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private List<PlaceCandidate> toCandidates(Map<String, Object> response, boolean byName) {
        if (response == null) {
            throw GatewayException.unavailable("Place lookup service returned an empty response", null);
        }

        String status = String.valueOf(response.get(Field.STATUS));
        String errorMessage = (String) response.get(Field.ERROR_MESSAGE);
        switch (status) {
            case Status.OK:
                break;
            case Status.ZERO_RESULTS:
                return Collections.emptyList();
            case Status.REQUEST_DENIED:
            case Status.INVALID_REQUEST:
                log.warn("Google Maps 요청 거절: status={}, message={}", status, errorMessage);
                throw GatewayException.rejected("Search parameter error: "
                        + (errorMessage != null ? errorMessage : status));
            default:
                // OVER_QUERY_LIMIT, UNKNOWN_ERROR 등
                log.error("Google Maps 오류 응답: status={}, message={}", status, errorMessage);
                throw GatewayException.unavailable("Place lookup service error: "
                        + (errorMessage != null ? errorMessage : status), null);
        }

        Object rawResults = response.get(Field.RESULTS);
        if (!(rawResults instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> results = (List<Map<String, Object>>) rawResults;

        // 주소 검색은 첫 번째 결과만 사용
        int limit = byName ? Math.min(results.size(), properties.getMaxResults()) : Math.min(results.size(), 1);
        List<PlaceCandidate> candidates = new ArrayList<>(limit);
        for (Map<String, Object> result : results.subList(0, limit)) {
            candidates.add(toCandidate(result, byName));
        }
        return candidates;
    }

    @SuppressWarnings("unchecked")
    private PlaceCandidate toCandidate(Map<String, Object> result, boolean byName) {
        Double latitude = null;
        Double longitude = null;
        Object geometry = result.get(Field.GEOMETRY);
        if (geometry instanceof Map) {
            Object location = ((Map<String, Object>) geometry).get(Field.LOCATION);
            if (location instanceof Map) {
                latitude = toDouble(((Map<String, Object>) location).get(Field.LAT));
                longitude = toDouble(((Map<String, Object>) location).get(Field.LNG));
            }
        }

        String address = (String) result.get(Field.FORMATTED_ADDRESS);
        return PlaceCandidate.builder()
                .placeId((String) result.get(Field.PLACE_ID))
                .name(byName ? (String) result.get(Field.NAME) : null)
                .address(address != null ? address : ADDRESS_NOT_AVAILABLE)
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }

    private Double toDouble(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }
}
