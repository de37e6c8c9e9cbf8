// =============================================================================
// AidRoute - Route Solver
// =============================================================================
package com.aidroute.router.service.solver;

import com.aidroute.router.model.Cluster;

/**
 * Strategy that computes a visiting order for one cluster.
 */
public interface RouteSolver {

    /**
     * Short identifier reported with each route, e.g. {@code osrm-trip}.
     */
    String name();

    /**
     * @return visiting order over {@code cluster.members()} and the distance
     *         of the complete path, including depot legs when anchored
     * @throws RouteSolverException when no order could be produced
     */
    RouteSolution solve(Cluster cluster) throws RouteSolverException;

    /**
     * Whether the solver calls out to an external service.
     */
    default boolean isExternal() {
        return false;
    }

    default boolean isEnabled() {
        return true;
    }
}
