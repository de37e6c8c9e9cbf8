// =============================================================================
// AidRoute - Route Planning Service Tests
// =============================================================================
package com.aidroute.router.service;

import com.aidroute.router.TestLocations;
import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.error.RoutingException;
import com.aidroute.router.model.Address;
import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.GeocodeStatus;
import com.aidroute.router.model.RouteSet;
import com.aidroute.router.service.cluster.GreedyProximityClusterer;
import com.aidroute.router.service.geocode.Geocoder;
import com.aidroute.router.service.solver.RouteOptimizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RoutePlanningServiceTest {

    @Mock
    private Geocoder geocoder;

    @Mock
    private RouteOptimizer routeOptimizer;

    @Captor
    private ArgumentCaptor<List<Cluster>> clustersCaptor;

    private RoutingProperties properties;
    private RoutePlanningService service;

    @BeforeEach
    void setUp() {
        properties = new RoutingProperties();
        service = new RoutePlanningService(geocoder, new GreedyProximityClusterer(), routeOptimizer, properties);
    }

    @Test
    @DisplayName("Only matched non-depot locations are clustered; the rest are reported as unroutable")
    void filtersBeforeClustering() {
        List<Address> addresses = List.of(
                Address.of("Depot"), Address.of("A"), Address.of("B"), Address.of("C"), Address.of("D"));
        GeocodeResult depot = TestLocations.depot().location();
        GeocodeResult a = TestLocations.matched("A", 44.99, -93.26);
        GeocodeResult b = GeocodeResult.failed(Address.of("B"), GeocodeStatus.NO_MATCH, "Not found");
        GeocodeResult c = GeocodeResult.builder().query(Address.of("C")).status(GeocodeStatus.OUT_OF_RADIUS)
                .displayName("Far").coordinate(TestLocations.DEPOT).errorDetail("outside").build();
        GeocodeResult d = TestLocations.matched("D", 45.00, -93.26);
        given(geocoder.geocode(addresses, 0, 10.0)).willReturn(List.of(depot, a, b, c, d));
        given(routeOptimizer.optimize(any(), eq(true))).willReturn(RouteSet.of(List.of()));

        RouteSet routeSet = service.planFromAddresses(addresses, 0, 10.0, 3, true);

        verify(routeOptimizer).optimize(clustersCaptor.capture(), eq(true));
        List<Cluster> clusters = clustersCaptor.getValue();
        assertThat(clusters).singleElement().satisfies(cluster -> {
            assertThat(cluster.members()).containsExactly(a, d);
            assertThat(cluster.anchor().location()).isEqualTo(depot);
        });
        assertThat(routeSet.unroutable()).containsExactly(b, c);
        assertThat(routeSet.depot().location()).isEqualTo(depot);
    }

    @Test
    @DisplayName("Unmatched depot gives open routes and is reported")
    void unmatchedDepot() {
        List<Address> addresses = List.of(Address.of("Depot"), Address.of("A"));
        GeocodeResult depot = GeocodeResult.failed(Address.of("Depot"), GeocodeStatus.ERROR, "HTTP 503");
        GeocodeResult a = TestLocations.matched("A", 44.99, -93.26);
        given(geocoder.geocode(addresses, 0, null)).willReturn(List.of(depot, a));
        given(routeOptimizer.optimize(any(), anyBoolean())).willReturn(RouteSet.of(List.of()));

        RouteSet routeSet = service.planFromAddresses(addresses, 0, null, null, false);

        verify(routeOptimizer).optimize(clustersCaptor.capture(), eq(false));
        assertThat(clustersCaptor.getValue()).noneMatch(Cluster::hasDepot);
        assertThat(routeSet.depot()).isNull();
        assertThat(routeSet.unroutable()).containsExactly(depot);
    }

    @Test
    @DisplayName("No geocoded locations is a total failure")
    void noRoutableLocations() {
        List<Address> addresses = List.of(Address.of("A"), Address.of("B"));
        given(geocoder.geocode(addresses, null, null)).willReturn(List.of(
                GeocodeResult.failed(Address.of("A"), GeocodeStatus.NO_MATCH, "Not found"),
                GeocodeResult.failed(Address.of("B"), GeocodeStatus.ERROR, "HTTP 503")));

        assertThatThrownBy(() -> service.planFromAddresses(addresses, null, null, 4, true))
                .isInstanceOfSatisfying(RoutingException.class,
                        e -> assertThat(e.getCode()).isEqualTo(RoutingErrorCode.NO_ROUTABLE_LOCATIONS));
        verifyNoInteractions(routeOptimizer);
    }

    @Test
    @DisplayName("Invalid route size is rejected before any geocoding")
    void invalidMaxStops() {
        assertThatThrownBy(() -> service.planFromAddresses(List.of(Address.of("A")), null, null, 0, true))
                .isInstanceOfSatisfying(RoutingException.class,
                        e -> assertThat(e.getCode()).isEqualTo(RoutingErrorCode.CLUSTER_CONFIG_INVALID));
        verify(geocoder, never()).geocode(any(), any(), any());
    }

    @Test
    @DisplayName("Configured default route size applies when none is requested")
    void defaultMaxStops() {
        properties.getOptimizer().setDefaultMaxStopsPerRoute(2);
        given(routeOptimizer.optimize(any(), anyBoolean())).willReturn(RouteSet.of(List.of()));

        service.planFromLocations(TestLocations.lineNorthOfDepot(5, 0.01), TestLocations.depot().location(), null, true);

        verify(routeOptimizer).optimize(clustersCaptor.capture(), eq(true));
        assertThat(clustersCaptor.getValue()).extracting(Cluster::size).containsExactly(2, 2, 1);
    }
}
