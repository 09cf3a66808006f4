package com.example.brite.google.service;

import com.example.brite.client.GoogleMapsClient;
import com.example.brite.config.GoogleMapsProperties;
import com.example.brite.dto.PlaceCandidate;
import com.example.brite.dto.PlaceQuery;
import com.example.brite.exception.GatewayException;
import com.example.brite.exception.ValidationException;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GooglePlaceLookupServiceTest {

    private GoogleMapsProperties properties;
    private final AtomicReference<URI> lastRequest = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        properties = new GoogleMapsProperties();
        properties.setApiKey("test-key");
        properties.setTimeout(Duration.ofMillis(300));
    }

    @Test
    void searchByName_ShouldMapResultsAndCapAtMaxResults() {
        StringBuilder results = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            if (i > 0) {
                results.append(',');
            }
            results.append("{\"name\":\"Hi-Lo ").append(i).append("\",\"place_id\":\"P").append(i)
                    .append("\",\"formatted_address\":\"Kingston ").append(i)
                    .append("\",\"geometry\":{\"location\":{\"lat\":18.01,\"lng\":-76.79}}}");
        }
        GooglePlaceLookupService service = serviceReturning(HttpStatus.OK,
                "{\"status\":\"OK\",\"results\":[" + results + "]}");

        List<PlaceCandidate> candidates = service.search(PlaceQuery.builder().name("Hi-Lo").build());

        assertThat(candidates).hasSize(10);
        PlaceCandidate first = candidates.get(0);
        assertThat(first.getName()).isEqualTo("Hi-Lo 0");
        assertThat(first.getPlaceId()).isEqualTo("P0");
        assertThat(first.getAddress()).isEqualTo("Kingston 0");
        assertThat(first.getLatitude()).isEqualTo(18.01);
        assertThat(first.getLongitude()).isEqualTo(-76.79);

        URI uri = lastRequest.get();
        assertThat(uri.getPath()).isEqualTo("/maps/api/place/textsearch/json");
        assertThat(uri.getQuery()).contains("query=Hi-Lo").contains("key=test-key").doesNotContain("radius");
    }

    @Test
    void searchByName_ShouldPassLocationBias() {
        GooglePlaceLookupService service = serviceReturning(HttpStatus.OK, "{\"status\":\"ZERO_RESULTS\",\"results\":[]}");

        List<PlaceCandidate> candidates = service.search(
                PlaceQuery.builder().name("MegaMart").location("18.01,-76.79").build());

        assertThat(candidates).isEmpty();
        assertThat(lastRequest.get().getQuery()).contains("location=18.01,-76.79").contains("radius=5000");
    }

    @Test
    void searchByName_ShouldFillMissingAddress() {
        GooglePlaceLookupService service = serviceReturning(HttpStatus.OK,
                "{\"status\":\"OK\",\"results\":[{\"name\":\"Pop-up Market\",\"place_id\":\"PX\"}]}");

        List<PlaceCandidate> candidates = service.search(PlaceQuery.builder().name("Pop-up").build());

        assertThat(candidates.get(0).getAddress()).isEqualTo("Address not available");
        assertThat(candidates.get(0).getLatitude()).isNull();
    }

    @Test
    void searchByAddress_ShouldReturnSingleUnnamedCandidate() {
        GooglePlaceLookupService service = serviceReturning(HttpStatus.OK,
                "{\"status\":\"OK\",\"results\":["
                        + "{\"place_id\":\"G1\",\"formatted_address\":\"1 Main St, Kingston\",\"geometry\":{\"location\":{\"lat\":18.0,\"lng\":-76.8}}},"
                        + "{\"place_id\":\"G2\",\"formatted_address\":\"1 Main St, Montego Bay\"}]}");

        List<PlaceCandidate> candidates = service.search(PlaceQuery.builder().address("1 Main St").build());

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).getPlaceId()).isEqualTo("G1");
        assertThat(candidates.get(0).getName()).isNull();
        assertThat(lastRequest.get().getPath()).isEqualTo("/maps/api/geocode/json");
    }

    @Test
    void search_ShouldRequireExactlyOneCriterion() {
        GooglePlaceLookupService service = serviceReturning(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> service.search(PlaceQuery.builder().build()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("A 'name' or 'address' query parameter is required");
        assertThatThrownBy(() -> service.search(PlaceQuery.builder().name("a").address("b").build()))
                .isInstanceOf(ValidationException.class);
        assertThat(lastRequest.get()).isNull();
    }

    @Test
    void search_ShouldRejectWhenUpstreamDeniesRequest() {
        GooglePlaceLookupService service = serviceReturning(HttpStatus.OK,
                "{\"status\":\"REQUEST_DENIED\",\"error_message\":\"The provided API key is invalid.\",\"results\":[]}");

        assertThatThrownBy(() -> service.search(PlaceQuery.builder().name("Hi-Lo").build()))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(e.getMessage()).isEqualTo("Search parameter error: The provided API key is invalid.");
                });
    }

    @Test
    void search_ShouldReportUpstreamOutageAsBadGateway() {
        GooglePlaceLookupService quota = serviceReturning(HttpStatus.OK, "{\"status\":\"OVER_QUERY_LIMIT\",\"results\":[]}");
        GooglePlaceLookupService serverError = serviceReturning(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        assertThatThrownBy(() -> quota.search(PlaceQuery.builder().name("Hi-Lo").build()))
                .isInstanceOfSatisfying(GatewayException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY));
        assertThatThrownBy(() -> serverError.search(PlaceQuery.builder().name("Hi-Lo").build()))
                .isInstanceOfSatisfying(GatewayException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY));
    }

    @Test
    void search_ShouldTimeOutInsteadOfHanging() {
        GooglePlaceLookupService service = service(request -> {
            lastRequest.set(request.url());
            return Mono.never();
        });

        assertThatThrownBy(() -> service.search(PlaceQuery.builder().name("Hi-Lo").build()))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
                    assertThat(e.getMessage()).isEqualTo("Place lookup service timed out");
                });
    }

    @Test
    void search_ShouldMapConnectionFailure() {
        GooglePlaceLookupService service = service(request -> Mono.error(new WebClientRequestException(
                new IOException("Connection refused"), HttpMethod.GET, request.url(), HttpHeaders.EMPTY)));

        assertThatThrownBy(() -> service.search(PlaceQuery.builder().address("1 Main St").build()))
                .isInstanceOfSatisfying(GatewayException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY));
    }

    @Test
    void search_ShouldFailWhenApiKeyMissing() {
        properties.setApiKey("");
        GooglePlaceLookupService service = serviceReturning(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> service.search(PlaceQuery.builder().name("Hi-Lo").build()))
                .isInstanceOf(GatewayException.class)
                .hasMessage("Google Maps API key is not configured");
        assertThat(lastRequest.get()).isNull();
    }

    private GooglePlaceLookupService serviceReturning(HttpStatus status, String body) {
        return service(request -> {
            lastRequest.set(request.url());
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
    }

    private GooglePlaceLookupService service(ExchangeFunction exchangeFunction) {
        WebClient webClient = WebClient.builder()
                .baseUrl(properties.getApiBaseUrl())
                .exchangeFunction(exchangeFunction)
                .build();
        return new GooglePlaceLookupService(new GoogleMapsClient(webClient, properties), properties);
    }
}
