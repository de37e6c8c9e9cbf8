// =============================================================================
// AidRoute - Trip Service Route Solver
// =============================================================================
package com.aidroute.router.service.solver;

import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.service.distance.DistanceCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.concurrent.TimeoutException;

/**
 * Delegates the visiting order to an OSRM {@code trip} service. The depot,
 * when present, is sent first and pinned as the trip source.
 */
@Slf4j
public class TripServiceRouteSolver implements RouteSolver {

    public static final String NAME = "osrm-trip";

    private final WebClient webClient;
    private final RoutingProperties.TripSolver properties;

    public TripServiceRouteSolver(WebClient.Builder builder, RoutingProperties.TripSolver properties) {
        this.webClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isExternal() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public RouteSolution solve(Cluster cluster) throws RouteSolverException {
        List<GeocodeResult> members = cluster.members();
        if (!cluster.hasDepot() && members.size() == 1) {
            return new RouteSolution(List.of(0), 0.0, 0.0);
        }

        List<Coordinate> coordinates = new ArrayList<>(members.size() + 1);
        if (cluster.hasDepot()) {
            coordinates.add(cluster.anchor().coordinate());
        }
        members.forEach(member -> coordinates.add(member.getCoordinate()));

        OsrmTripResponse response = requestTrip(cluster.id(), coordinates);
        return toSolution(cluster, coordinates.size(), response);
    }

    private OsrmTripResponse requestTrip(int clusterId, List<Coordinate> coordinates) throws RouteSolverException {
        String path = "/trip/v1/" + properties.getProfile() + "/" + encode(coordinates);
        Duration timeout = properties.getTimeout();
        log.debug("Requesting trip: cluster={}, coordinates={}", clusterId, coordinates.size());
        try {
            return webClient.get()
                    .uri(uriBuilder -> uriBuilder.path(path)
                            .queryParam("roundtrip", true)
                            .queryParam("source", "first")
                            .queryParam("overview", false)
                            .queryParam("steps", false)
                            .build())
                    .retrieve()
                    .bodyToMono(OsrmTripResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                    "Trip service returned HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                    "Trip service unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_TIMEOUT,
                        "Trip service timed out after " + timeout.toMillis() + "ms", e);
            }
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                    "Trip service error: " + e.getMessage(), e);
        }
    }

    private RouteSolution toSolution(Cluster cluster, int coordinateCount, OsrmTripResponse response)
            throws RouteSolverException {
        if (response == null || !"Ok".equals(response.getCode())) {
            String detail = response == null ? "empty response" : response.getCode() + " " + response.getMessage();
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR, "Trip service rejected request: " + detail);
        }
        if (response.getTrips() == null || response.getTrips().size() != 1) {
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                    "Expected a single trip, got " + (response.getTrips() == null ? 0 : response.getTrips().size()));
        }
        List<OsrmTripResponse.Waypoint> waypoints = response.getWaypoints();
        if (waypoints == null || waypoints.size() != coordinateCount) {
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                    "Trip service returned " + (waypoints == null ? 0 : waypoints.size())
                            + " waypoints for " + coordinateCount + " coordinates");
        }

        // waypoint_index is the trip position of each input coordinate
        int[] inputAtPosition = new int[coordinateCount];
        Arrays.fill(inputAtPosition, -1);
        for (int input = 0; input < coordinateCount; input++) {
            Integer position = waypoints.get(input).getWaypointIndex();
            if (position == null || position < 0 || position >= coordinateCount || inputAtPosition[position] >= 0) {
                throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                        "Trip service returned an invalid waypoint order");
            }
            inputAtPosition[position] = input;
        }
        if (inputAtPosition[0] != 0) {
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                    "Trip does not start at the requested source");
        }

        int offset = cluster.hasDepot() ? 1 : 0;
        List<Integer> order = new ArrayList<>(cluster.size());
        for (int position = 0; position < coordinateCount; position++) {
            int member = inputAtPosition[position] - offset;
            if (member >= 0) {
                order.add(member);
            }
        }

        OsrmTripResponse.Trip trip = response.getTrips().get(0);
        double meters = trip.getDistance();
        double seconds = trip.getDuration();
        List<OsrmTripResponse.Leg> legs = trip.getLegs();
        if (!cluster.hasDepot() && legs != null && !legs.isEmpty()) {
            // Open route: drop the closing leg back to the seed stop
            OsrmTripResponse.Leg closing = legs.get(legs.size() - 1);
            meters -= closing.getDistance();
            seconds -= closing.getDuration();
        }

        return new RouteSolution(order,
                Math.max(0, meters) / DistanceCalculator.METERS_PER_MILE,
                Math.max(0, seconds) / 60.0);
    }

    private static String encode(List<Coordinate> coordinates) {
        StringJoiner joiner = new StringJoiner(";");
        for (Coordinate coordinate : coordinates) {
            joiner.add(String.format(Locale.ROOT, "%.7f,%.7f", coordinate.longitude(), coordinate.latitude()));
        }
        return joiner.toString();
    }
}
