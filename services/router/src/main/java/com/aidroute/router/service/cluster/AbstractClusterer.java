// =============================================================================
// AidRoute - Abstract Clusterer
// =============================================================================
package com.aidroute.router.service.cluster;

import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.error.RoutingException;
import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.Depot;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.service.distance.DistanceCalculator;

import java.util.List;

/**
 * Input validation and nearest-stop search shared by the clusterers.
 */
abstract class AbstractClusterer implements Clusterer {

    @Override
    public final List<Cluster> cluster(List<GeocodeResult> stops, Depot depot, int maxStopsPerRoute) {
        if (maxStopsPerRoute < 1) {
            throw new RoutingException(RoutingErrorCode.CLUSTER_CONFIG_INVALID,
                    "maxStopsPerRoute must be at least 1, was " + maxStopsPerRoute);
        }
        for (GeocodeResult stop : stops) {
            if (!stop.isMatched()) {
                throw new IllegalArgumentException(
                        "Unmatched stop passed to clustering: " + stop.getQuery().getText());
            }
        }
        if (stops.isEmpty()) {
            return List.of();
        }
        return partition(stops, depot, maxStopsPerRoute);
    }

    protected abstract List<Cluster> partition(List<GeocodeResult> stops, Depot depot, int maxStopsPerRoute);

    /**
     * Index of the unassigned stop nearest to {@code target} by road distance.
     * Ties go to the lower index.
     */
    static int nearestUnassigned(List<GeocodeResult> stops, boolean[] assigned, Coordinate target) {
        int best = -1;
        double bestMiles = Double.POSITIVE_INFINITY;
        for (int i = 0; i < stops.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            double miles = DistanceCalculator.roadMiles(target, stops.get(i).getCoordinate());
            if (miles < bestMiles) {
                bestMiles = miles;
                best = i;
            }
        }
        return best;
    }
}
