// =============================================================================
// AidRoute - Nominatim Geocoding Provider
// =============================================================================
package com.aidroute.router.service.geocode;

import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.model.Coordinate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * {@link GeocodingProvider} backed by an OpenStreetMap Nominatim instance.
 */
@Slf4j
public class NominatimGeocodingProvider implements GeocodingProvider {

    private final WebClient webClient;
    private final Duration timeout;
    private final String countryCodes;

    public NominatimGeocodingProvider(WebClient.Builder builder, RoutingProperties.Geocoder properties) {
        this.webClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.timeout = properties.getTimeout();
        this.countryCodes = properties.getCountryCodes();
    }

    @Override
    public List<GeocodeCandidate> search(String query, int limit) throws GeocodingProviderException {
        NominatimPlace[] places;
        try {
            places = webClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/search")
                                .queryParam("q", query)
                                .queryParam("format", "jsonv2")
                                .queryParam("limit", limit)
                                .queryParam("addressdetails", 1);
                        if (countryCodes != null && !countryCodes.isBlank()) {
                            uriBuilder.queryParam("countrycodes", countryCodes);
                        }
                        return uriBuilder.build();
                    })
                    .retrieve()
                    .bodyToMono(NominatimPlace[].class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            boolean retryable = status.is5xxServerError() || status.value() == 429;
            throw new GeocodingProviderException(
                    "Geocoding service returned HTTP " + status.value(), retryable, e);
        } catch (WebClientRequestException e) {
            throw new GeocodingProviderException("Geocoding service unavailable: " + e.getMessage(), true, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new GeocodingProviderException("Geocoding timed out after " + timeout.toMillis() + "ms", true, e);
            }
            throw new GeocodingProviderException("Geocoding service error: " + e.getMessage(), false, e);
        }

        List<GeocodeCandidate> candidates = new ArrayList<>();
        if (places == null) {
            return candidates;
        }
        for (NominatimPlace place : places) {
            if (place.getLat() == null || place.getLon() == null) {
                log.debug("Skipping candidate without coordinates: query={}, name={}", query, place.getDisplayName());
                continue;
            }
            try {
                candidates.add(new GeocodeCandidate(
                        place.getDisplayName(), Coordinate.of(place.getLat(), place.getLon())));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping candidate with invalid coordinates: query={}, reason={}", query, e.getMessage());
            }
        }
        return candidates;
    }
}
