// =============================================================================
// AidRoute - Greedy Proximity Clusterer Tests
// =============================================================================
package com.aidroute.router.service.cluster;

import com.aidroute.router.TestLocations;
import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.error.RoutingException;
import com.aidroute.router.model.Address;
import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.GeocodeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GreedyProximityClustererTest {

    private final Clusterer clusterer = new GreedyProximityClusterer();

    @Test
    @DisplayName("Nine stops with four per route give sizes 4, 4, 1 in depot-proximity order")
    void nineStopsFourPerRoute() {
        List<GeocodeResult> stops = TestLocations.lineNorthOfDepot(9, 0.01);

        List<Cluster> clusters = clusterer.cluster(stops, TestLocations.depot(), 4);

        assertThat(clusters).extracting(Cluster::size).containsExactly(4, 4, 1);
        assertThat(clusters).extracting(Cluster::id).containsExactly(1, 2, 3);
        assertThat(clusters.get(0).members()).containsExactlyInAnyOrderElementsOf(stops.subList(0, 4));
        assertThat(clusters.get(1).members()).containsExactlyInAnyOrderElementsOf(stops.subList(4, 8));
        assertThat(clusters.get(2).members()).containsExactly(stops.get(8));
        assertThat(clusters).allMatch(Cluster::hasDepot);
    }

    @ParameterizedTest(name = "maxStopsPerRoute={0}")
    @ValueSource(ints = {1, 2, 3, 4, 7, 50})
    @DisplayName("Clusters partition the input and respect the size bound")
    void partitionProperty(int maxStopsPerRoute) {
        List<GeocodeResult> stops = scattered(23, 42L);

        List<Cluster> clusters = clusterer.cluster(stops, TestLocations.depot(), maxStopsPerRoute);

        ClusterAssertions.assertPartition(stops, clusters, maxStopsPerRoute);
        assertThat(clusters).hasSize((stops.size() + maxStopsPerRoute - 1) / maxStopsPerRoute);
    }

    @Test
    @DisplayName("Without a depot clustering starts from the first stop")
    void noDepot() {
        List<GeocodeResult> stops = TestLocations.lineNorthOfDepot(5, 0.01);

        List<Cluster> clusters = clusterer.cluster(stops, null, 2);

        assertThat(clusters).extracting(Cluster::size).containsExactly(2, 2, 1);
        assertThat(clusters.get(0).members()).containsExactly(stops.get(0), stops.get(1));
        assertThat(clusters).noneMatch(Cluster::hasDepot);
    }

    @Test
    @DisplayName("Equal distances are broken by input order")
    void deterministicTies() {
        List<GeocodeResult> stops = List.of(
                TestLocations.matched("East", 44.9778, -93.2550),
                TestLocations.matched("West", 44.9778, -93.2750));

        List<Cluster> first = clusterer.cluster(stops, TestLocations.depot(), 1);
        List<Cluster> second = clusterer.cluster(stops, TestLocations.depot(), 1);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Empty input gives no clusters")
    void emptyInput() {
        assertThat(clusterer.cluster(List.of(), TestLocations.depot(), 4)).isEmpty();
    }

    @Test
    @DisplayName("Route size below one is a configuration error")
    void invalidMaxStops() {
        assertThatThrownBy(() -> clusterer.cluster(TestLocations.lineNorthOfDepot(3, 0.01), null, 0))
                .isInstanceOfSatisfying(RoutingException.class,
                        e -> assertThat(e.getCode()).isEqualTo(RoutingErrorCode.CLUSTER_CONFIG_INVALID));
    }

    @Test
    @DisplayName("Unmatched stops are rejected")
    void rejectsUnmatched() {
        GeocodeResult unmatched = GeocodeResult.failed(Address.of("Nowhere"), GeocodeStatus.NO_MATCH, "Not found");

        assertThatThrownBy(() -> clusterer.cluster(List.of(unmatched), null, 4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static List<GeocodeResult> scattered(int count, long seed) {
        Random random = new Random(seed);
        List<GeocodeResult> stops = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            stops.add(TestLocations.matched("Stop " + i,
                    44.85 + random.nextDouble() * 0.25,
                    -93.45 + random.nextDouble() * 0.35));
        }
        return stops;
    }
}
