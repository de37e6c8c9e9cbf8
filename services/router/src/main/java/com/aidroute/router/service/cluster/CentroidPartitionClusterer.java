// =============================================================================
// AidRoute - Centroid Partition Clusterer
// =============================================================================
package com.aidroute.router.service.cluster;

import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.Depot;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.service.distance.DistanceCalculator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Centroid-based partitioning (Lloyd's k-means) with
 * {@code k = ceil(n / maxStopsPerRoute)}, deterministic farthest-point seeding
 * and a capacity repair pass that moves the outermost members of oversized
 * groups to the nearest group with room.
 */
@Slf4j
public class CentroidPartitionClusterer extends AbstractClusterer {

    private static final int MAX_ITERATIONS = 50;

    @Override
    protected List<Cluster> partition(List<GeocodeResult> stops, Depot depot, int maxStopsPerRoute) {
        int n = stops.size();
        int k = (n + maxStopsPerRoute - 1) / maxStopsPerRoute;

        Coordinate[] centers = seedCenters(stops, depot, k);
        int[] assignment = new int[n];

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int nearest = nearestCenter(centers, stops.get(i).getCoordinate());
                if (nearest != assignment[i]) {
                    assignment[i] = nearest;
                    changed = true;
                }
            }
            recomputeCenters(stops, assignment, centers);
            if (iteration > 0 && !changed) {
                log.debug("Centroid clustering converged after {} iterations", iteration + 1);
                break;
            }
        }

        repairCapacity(stops, assignment, centers, maxStopsPerRoute);

        List<List<GeocodeResult>> groups = new ArrayList<>();
        for (int c = 0; c < k; c++) {
            groups.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            groups.get(assignment[i]).add(stops.get(i));
        }
        groups.removeIf(List::isEmpty);

        if (depot != null) {
            // Depot-proximity order, stable for equal distances
            groups.sort(Comparator.comparingDouble(group -> DistanceCalculator.roadMiles(
                    depot.coordinate(), DistanceCalculator.centroid(coordinates(group)))));
        }

        List<Cluster> clusters = new ArrayList<>(groups.size());
        for (List<GeocodeResult> group : groups) {
            clusters.add(new Cluster(clusters.size() + 1, group, depot));
        }
        return clusters;
    }

    private static Coordinate[] seedCenters(List<GeocodeResult> stops, Depot depot, int k) {
        Coordinate[] centers = new Coordinate[k];
        boolean[] chosen = new boolean[stops.size()];
        int first = depot != null ? nearestUnassigned(stops, chosen, depot.coordinate()) : 0;
        chosen[first] = true;
        centers[0] = stops.get(first).getCoordinate();

        for (int c = 1; c < k; c++) {
            int farthest = -1;
            double farthestMiles = -1;
            for (int i = 0; i < stops.size(); i++) {
                if (chosen[i]) {
                    continue;
                }
                double miles = Double.POSITIVE_INFINITY;
                for (int j = 0; j < c; j++) {
                    miles = Math.min(miles, DistanceCalculator.roadMiles(centers[j], stops.get(i).getCoordinate()));
                }
                if (miles > farthestMiles) {
                    farthestMiles = miles;
                    farthest = i;
                }
            }
            chosen[farthest] = true;
            centers[c] = stops.get(farthest).getCoordinate();
        }
        return centers;
    }

    private static int nearestCenter(Coordinate[] centers, Coordinate point) {
        int best = 0;
        double bestMiles = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centers.length; c++) {
            double miles = DistanceCalculator.roadMiles(centers[c], point);
            if (miles < bestMiles) {
                bestMiles = miles;
                best = c;
            }
        }
        return best;
    }

    private static void recomputeCenters(List<GeocodeResult> stops, int[] assignment, Coordinate[] centers) {
        for (int c = 0; c < centers.length; c++) {
            List<Coordinate> members = new ArrayList<>();
            for (int i = 0; i < stops.size(); i++) {
                if (assignment[i] == c) {
                    members.add(stops.get(i).getCoordinate());
                }
            }
            // An emptied group keeps its previous center
            if (!members.isEmpty()) {
                centers[c] = DistanceCalculator.centroid(members);
            }
        }
    }

    /**
     * Moves members out of groups above capacity. Total capacity
     * {@code k * maxStopsPerRoute} is at least {@code n}, so a group with room
     * always exists and each move removes one unit of overflow.
     */
    private static void repairCapacity(List<GeocodeResult> stops, int[] assignment, Coordinate[] centers,
                                       int maxStopsPerRoute) {
        int[] sizes = new int[centers.length];
        for (int group : assignment) {
            sizes[group]++;
        }

        for (int c = 0; c < centers.length; c++) {
            while (sizes[c] > maxStopsPerRoute) {
                int outermost = -1;
                double outermostMiles = -1;
                for (int i = 0; i < stops.size(); i++) {
                    if (assignment[i] != c) {
                        continue;
                    }
                    double miles = DistanceCalculator.roadMiles(centers[c], stops.get(i).getCoordinate());
                    if (miles > outermostMiles) {
                        outermostMiles = miles;
                        outermost = i;
                    }
                }

                int target = -1;
                double targetMiles = Double.POSITIVE_INFINITY;
                for (int other = 0; other < centers.length; other++) {
                    if (other == c || sizes[other] >= maxStopsPerRoute) {
                        continue;
                    }
                    double miles = DistanceCalculator.roadMiles(centers[other], stops.get(outermost).getCoordinate());
                    if (miles < targetMiles) {
                        targetMiles = miles;
                        target = other;
                    }
                }

                assignment[outermost] = target;
                sizes[c]--;
                sizes[target]++;
            }
        }
    }

    private static List<Coordinate> coordinates(List<GeocodeResult> group) {
        List<Coordinate> coordinates = new ArrayList<>(group.size());
        for (GeocodeResult stop : group) {
            coordinates.add(stop.getCoordinate());
        }
        return coordinates;
    }
}
