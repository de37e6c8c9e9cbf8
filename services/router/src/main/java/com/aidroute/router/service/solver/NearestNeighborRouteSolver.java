// =============================================================================
// AidRoute - Nearest Neighbor Route Solver
// =============================================================================
package com.aidroute.router.service.solver;

import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.service.distance.DistanceCalculator;

import java.util.ArrayList;
import java.util.List;

/**
 * Local greedy tour: start at the depot (or the cluster's seed stop), always
 * drive to the nearest unvisited stop by road distance, and return to the
 * depot at the end.
 */
public class NearestNeighborRouteSolver implements RouteSolver {

    public static final String NAME = "nearest-neighbor";

    private final double averageSpeedMph;

    public NearestNeighborRouteSolver(double averageSpeedMph) {
        this.averageSpeedMph = averageSpeedMph;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RouteSolution solve(Cluster cluster) throws RouteSolverException {
        List<GeocodeResult> members = cluster.members();
        boolean[] visited = new boolean[members.size()];
        List<Integer> order = new ArrayList<>(members.size());
        double miles = 0;

        Coordinate current;
        if (cluster.hasDepot()) {
            current = cluster.anchor().coordinate();
        } else {
            order.add(0);
            visited[0] = true;
            current = members.get(0).getCoordinate();
        }

        while (order.size() < members.size()) {
            int nearest = -1;
            double nearestMiles = Double.POSITIVE_INFINITY;
            for (int i = 0; i < members.size(); i++) {
                if (visited[i]) {
                    continue;
                }
                double d = DistanceCalculator.roadMiles(current, members.get(i).getCoordinate());
                if (d < nearestMiles) {
                    nearestMiles = d;
                    nearest = i;
                }
            }
            if (nearest < 0) {
                throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                        "No reachable stop left in cluster " + cluster.id());
            }
            visited[nearest] = true;
            order.add(nearest);
            miles += nearestMiles;
            current = members.get(nearest).getCoordinate();
        }

        if (cluster.hasDepot()) {
            miles += DistanceCalculator.roadMiles(current, cluster.anchor().coordinate());
        }

        Double minutes = averageSpeedMph > 0 ? miles / averageSpeedMph * 60.0 : null;
        return new RouteSolution(order, miles, minutes);
    }
}
