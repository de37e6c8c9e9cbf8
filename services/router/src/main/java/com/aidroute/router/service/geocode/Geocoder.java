// =============================================================================
// AidRoute - Geocoder
// =============================================================================
package com.aidroute.router.service.geocode;

import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.error.RoutingException;
import com.aidroute.router.model.Address;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.GeocodeStatus;
import com.aidroute.router.service.distance.DistanceCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves addresses to coordinates through the configured
 * {@link GeocodingProvider}.
 *
 * <p>Every outbound request, including retries and variation attempts, passes
 * through the shared {@link RateGate}. Lookups are issued in input order and
 * results are returned in input order, one per address. Failures are reported
 * as result statuses and never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Geocoder {

    private final GeocodingProvider provider;
    private final RateGate rateGate;
    private final RoutingProperties properties;
    private final Sleeper sleeper;

    /**
     * Geocode a batch of addresses.
     *
     * @param addresses   addresses in caller order
     * @param depotIndex  position of the depot within {@code addresses}, or {@code null}
     * @param radiusMiles maximum geodesic distance from the depot, or {@code null}
     *                    for no radius filter; ignored when the depot does not match
     * @return one result per address, same order as the input
     */
    public List<GeocodeResult> geocode(List<Address> addresses, Integer depotIndex, Double radiusMiles) {
        if (addresses.isEmpty()) {
            return List.of();
        }
        if (depotIndex != null && (depotIndex < 0 || depotIndex >= addresses.size())) {
            throw new RoutingException(RoutingErrorCode.INVALID_REQUEST,
                    "Depot index " + depotIndex + " outside 0.." + (addresses.size() - 1));
        }
        if (radiusMiles != null && !(radiusMiles > 0)) {
            throw new RoutingException(RoutingErrorCode.INVALID_REQUEST, "Radius must be positive: " + radiusMiles);
        }

        log.info("Geocoding batch: addresses={}, depotIndex={}, radiusMiles={}",
                addresses.size(), depotIndex, radiusMiles);

        GeocodeResult[] results = new GeocodeResult[addresses.size()];
        Coordinate depot = null;

        if (depotIndex != null) {
            GeocodeResult depotResult = geocodeOne(addresses.get(depotIndex), null, null);
            if (depotResult.isMatched()) {
                depot = depotResult.getCoordinate();
                depotResult = depotResult.toBuilder().distanceFromDepotMiles(0.0).build();
                log.info("Depot matched: name={}, lat={}, lon={}",
                        depotResult.getDisplayName(), depot.latitude(), depot.longitude());
            } else {
                log.warn("Depot not matched, radius filter disabled: address={}, status={}",
                        addresses.get(depotIndex).getText(), depotResult.getStatus());
            }
            results[depotIndex] = depotResult;
        }

        Double effectiveRadius = depot != null ? radiusMiles : null;
        for (int i = 0; i < addresses.size(); i++) {
            if (depotIndex != null && i == depotIndex) {
                continue;
            }
            results[i] = geocodeOne(addresses.get(i), depot, effectiveRadius);
        }

        logSummary(results);
        return List.of(results);
    }

    /**
     * Geocode a single address, trying variations until one yields an
     * acceptable candidate.
     */
    GeocodeResult geocodeOne(Address address, Coordinate depot, Double radiusMiles) {
        RoutingProperties.Geocoder config = properties.getGeocoder();
        List<String> variations = AddressVariations.of(address.getText(), config.getMaxVariations());
        if (variations.isEmpty()) {
            return GeocodeResult.failed(address, GeocodeStatus.NO_MATCH, "Empty address");
        }

        GeocodeCandidate nearestOutside = null;
        double nearestOutsideMiles = Double.POSITIVE_INFINITY;
        String lastError = null;
        int failedVariations = 0;

        for (int v = 0; v < variations.size(); v++) {
            String variation = variations.get(v);
            if (v > 0) {
                log.debug("Trying variation {}: {}", v, variation);
            }

            List<GeocodeCandidate> candidates;
            try {
                candidates = searchWithRetry(variation, config);
            } catch (GeocodingProviderException e) {
                log.warn("Geocoding failed: address={}, variation={}, reason={}",
                        address.getText(), v, e.getMessage());
                lastError = e.getMessage();
                failedVariations++;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return GeocodeResult.failed(address, GeocodeStatus.ERROR, "Geocoding interrupted");
            }

            for (GeocodeCandidate candidate : candidates) {
                if (depot == null) {
                    return GeocodeResult.matched(address, candidate.displayName(), candidate.coordinate());
                }
                double miles = DistanceCalculator.geodesicMiles(depot, candidate.coordinate());
                log.debug("Candidate: name={}, distance={}mi", candidate.displayName(), round(miles));
                if (radiusMiles == null || miles <= radiusMiles) {
                    return GeocodeResult.matched(address, candidate.displayName(), candidate.coordinate())
                            .toBuilder()
                            .distanceFromDepotMiles(round(miles))
                            .build();
                }
                if (miles < nearestOutsideMiles) {
                    nearestOutsideMiles = miles;
                    nearestOutside = candidate;
                }
            }
        }

        if (nearestOutside != null) {
            return GeocodeResult.builder()
                    .query(address)
                    .displayName(nearestOutside.displayName())
                    .coordinate(nearestOutside.coordinate())
                    .status(GeocodeStatus.OUT_OF_RADIUS)
                    .distanceFromDepotMiles(round(nearestOutsideMiles))
                    .errorDetail(String.format(Locale.ROOT,
                            "Nearest match is %.1f mi from depot, outside the %.1f mi radius",
                            nearestOutsideMiles, radiusMiles))
                    .build();
        }
        if (failedVariations == variations.size()) {
            return GeocodeResult.failed(address, GeocodeStatus.ERROR, lastError);
        }
        return GeocodeResult.failed(address, GeocodeStatus.NO_MATCH,
                "Not found (tried " + variations.size() + " variations)");
    }

    private List<GeocodeCandidate> searchWithRetry(String query, RoutingProperties.Geocoder config)
            throws GeocodingProviderException, InterruptedException {
        for (int attempt = 0; ; attempt++) {
            rateGate.acquire();
            try {
                return provider.search(query, config.getCandidateLimit());
            } catch (GeocodingProviderException e) {
                if (!e.isTransientFailure() || attempt >= config.getMaxRetries()) {
                    throw e;
                }
                long backoffNanos = config.getRetryBackoff().toNanos() * (1L << attempt);
                log.warn("Geocoding attempt {} failed, retrying: query={}, reason={}",
                        attempt + 1, query, e.getMessage());
                if (backoffNanos > 0) {
                    sleeper.sleep(backoffNanos);
                }
            }
        }
    }

    private static void logSummary(GeocodeResult[] results) {
        Map<GeocodeStatus, Integer> counts = new EnumMap<>(GeocodeStatus.class);
        Arrays.stream(results).forEach(result -> counts.merge(result.getStatus(), 1, Integer::sum));
        log.info("Geocoding complete: matched={}, noMatch={}, outOfRadius={}, error={}",
                counts.getOrDefault(GeocodeStatus.MATCHED, 0),
                counts.getOrDefault(GeocodeStatus.NO_MATCH, 0),
                counts.getOrDefault(GeocodeStatus.OUT_OF_RADIUS, 0),
                counts.getOrDefault(GeocodeStatus.ERROR, 0));
    }

    private static double round(double miles) {
        return Math.round(miles * 10.0) / 10.0;
    }
}
