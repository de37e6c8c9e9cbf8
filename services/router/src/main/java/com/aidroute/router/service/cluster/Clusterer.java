// =============================================================================
// AidRoute - Clusterer
// =============================================================================
package com.aidroute.router.service.cluster;

import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.Depot;
import com.aidroute.router.model.GeocodeResult;

import java.util.List;

/**
 * Partitions matched stops into bounded-size groups, one per route.
 *
 * <p>Every implementation returns an exact partition of {@code stops}: each
 * stop appears in exactly one cluster and every cluster holds between 1 and
 * {@code maxStopsPerRoute} members. Output is deterministic for a given input
 * order.
 */
public interface Clusterer {

    /**
     * @param stops            matched stops, depot excluded
     * @param depot            route anchor, or {@code null}
     * @param maxStopsPerRoute upper bound on cluster size, at least 1
     * @throws com.aidroute.router.error.RoutingException with
     *         {@code CLUSTER_CONFIG_INVALID} when {@code maxStopsPerRoute < 1}
     */
    List<Cluster> cluster(List<GeocodeResult> stops, Depot depot, int maxStopsPerRoute);
}
