// =============================================================================
// AidRoute - Nominatim Geocoding Provider Tests
// =============================================================================
package com.aidroute.router.service.geocode;

import com.aidroute.router.config.RoutingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NominatimGeocodingProviderTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private RoutingProperties.Geocoder properties;

    @BeforeEach
    void setUp() {
        properties = new RoutingProperties.Geocoder();
        properties.setBaseUrl("http://geocoder.test");
        properties.setCountryCodes("us");
    }

    @Test
    @DisplayName("Search parses candidates and sends the identifying User-Agent")
    void parsesCandidates() throws Exception {
        String body = """
                [
                  {"lat": "44.9778", "lon": "-93.2650", "display_name": "Minneapolis, Minnesota, USA", "importance": 0.8},
                  {"lat": "44.9800", "lon": "-93.2700", "display_name": "Main Street, Minneapolis"}
                ]
                """;
        NominatimGeocodingProvider provider = provider(respond(HttpStatus.OK, body));

        List<GeocodeCandidate> candidates = provider.search("123 Main St, Minneapolis, MN 55401", 5);

        assertThat(candidates).hasSize(2);
        assertThat(candidates.get(0).displayName()).isEqualTo("Minneapolis, Minnesota, USA");
        assertThat(candidates.get(0).coordinate().latitude()).isCloseTo(44.9778, within(1e-9));
        assertThat(candidates.get(0).coordinate().longitude()).isCloseTo(-93.2650, within(1e-9));

        ClientRequest request = lastRequest.get();
        assertThat(request.url().getPath()).isEqualTo("/search");
        assertThat(request.url().getQuery())
                .contains("q=123 Main St, Minneapolis, MN 55401")
                .contains("format=jsonv2")
                .contains("limit=5")
                .contains("countrycodes=us");
        assertThat(request.headers().getFirst(HttpHeaders.USER_AGENT)).isEqualTo("aidroute-delivery-router/1.0");
    }

    @Test
    @DisplayName("Empty result array yields no candidates")
    void emptyResult() throws Exception {
        assertThat(provider(respond(HttpStatus.OK, "[]")).search("nowhere", 5)).isEmpty();
    }

    @Test
    @DisplayName("Candidates with invalid coordinates are skipped")
    void skipsInvalidCoordinates() throws Exception {
        String body = """
                [{"lat": "95.0", "lon": "10.0", "display_name": "Broken"},
                 {"display_name": "No position"},
                 {"lat": "45.0", "lon": "-93.0", "display_name": "Valid"}]
                """;

        List<GeocodeCandidate> candidates = provider(respond(HttpStatus.OK, body)).search("x", 5);

        assertThat(candidates).extracting(GeocodeCandidate::displayName).containsExactly("Valid");
    }

    @Test
    @DisplayName("Server errors and throttling are transient")
    void serverErrorsAreTransient() {
        assertThatThrownBy(() -> provider(respond(HttpStatus.SERVICE_UNAVAILABLE, "")).search("x", 5))
                .isInstanceOfSatisfying(GeocodingProviderException.class,
                        e -> assertThat(e.isTransientFailure()).isTrue());
        assertThatThrownBy(() -> provider(respond(HttpStatus.TOO_MANY_REQUESTS, "")).search("x", 5))
                .isInstanceOfSatisfying(GeocodingProviderException.class,
                        e -> assertThat(e.isTransientFailure()).isTrue());
    }

    @Test
    @DisplayName("Client errors are permanent")
    void clientErrorsArePermanent() {
        assertThatThrownBy(() -> provider(respond(HttpStatus.BAD_REQUEST, "")).search("x", 5))
                .isInstanceOfSatisfying(GeocodingProviderException.class,
                        e -> assertThat(e.isTransientFailure()).isFalse());
    }

    @Test
    @DisplayName("Timeouts are transient")
    void timeoutIsTransient() {
        properties.setTimeout(Duration.ofMillis(50));
        ExchangeFunction neverAnswers = request -> Mono.never();

        assertThatThrownBy(() -> provider(neverAnswers).search("x", 5))
                .isInstanceOfSatisfying(GeocodingProviderException.class, e -> {
                    assertThat(e.isTransientFailure()).isTrue();
                    assertThat(e.getMessage()).contains("timed out");
                });
    }

    private NominatimGeocodingProvider provider(ExchangeFunction exchange) {
        return new NominatimGeocodingProvider(WebClient.builder().exchangeFunction(exchange), properties);
    }

    private ExchangeFunction respond(HttpStatus status, String body) {
        return request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        };
    }
}
