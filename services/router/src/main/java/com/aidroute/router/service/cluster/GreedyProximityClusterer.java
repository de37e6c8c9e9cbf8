// =============================================================================
// AidRoute - Greedy Proximity Clusterer
// =============================================================================
package com.aidroute.router.service.cluster;

import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.Depot;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.service.distance.DistanceCalculator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Anchored greedy growth: each cluster is seeded with the unassigned stop
 * nearest the depot and grows by repeatedly taking the unassigned stop nearest
 * its current centroid until full.
 */
@Slf4j
public class GreedyProximityClusterer extends AbstractClusterer {

    @Override
    protected List<Cluster> partition(List<GeocodeResult> stops, Depot depot, int maxStopsPerRoute) {
        boolean[] assigned = new boolean[stops.size()];
        int remaining = stops.size();
        List<Cluster> clusters = new ArrayList<>();
        Coordinate previousLast = null;

        while (remaining > 0) {
            int seed;
            if (depot != null) {
                seed = nearestUnassigned(stops, assigned, depot.coordinate());
            } else if (previousLast == null) {
                seed = 0;
            } else {
                seed = nearestUnassigned(stops, assigned, previousLast);
            }

            List<GeocodeResult> members = new ArrayList<>();
            List<Coordinate> positions = new ArrayList<>();
            assigned[seed] = true;
            remaining--;
            members.add(stops.get(seed));
            positions.add(stops.get(seed).getCoordinate());

            while (members.size() < maxStopsPerRoute && remaining > 0) {
                Coordinate centroid = DistanceCalculator.centroid(positions);
                int next = nearestUnassigned(stops, assigned, centroid);
                assigned[next] = true;
                remaining--;
                members.add(stops.get(next));
                positions.add(stops.get(next).getCoordinate());
            }

            clusters.add(new Cluster(clusters.size() + 1, members, depot));
            previousLast = positions.get(positions.size() - 1);
            log.debug("Created cluster {} with {} stops", clusters.size(), members.size());
        }

        return clusters;
    }
}
