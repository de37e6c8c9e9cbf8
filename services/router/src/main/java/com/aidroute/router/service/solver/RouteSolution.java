// =============================================================================
// AidRoute - Route Solution
// =============================================================================
package com.aidroute.router.service.solver;

import java.util.List;

/**
 * Raw solver output.
 *
 * @param visitOrder      indexes into the cluster's members, in visiting order,
 *                        depot excluded
 * @param distanceMiles   length of the whole path
 * @param durationMinutes travel time, or {@code null} when not estimated
 */
public record RouteSolution(List<Integer> visitOrder, double distanceMiles, Double durationMinutes) {

    public RouteSolution {
        visitOrder = List.copyOf(visitOrder);
    }
}
