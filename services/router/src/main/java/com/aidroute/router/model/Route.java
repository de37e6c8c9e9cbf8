// =============================================================================
// AidRoute - Route
// =============================================================================
package com.aidroute.router.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ordered visiting plan for one cluster.
 */
@Value
@Builder(toBuilder = true)
public class Route {

    int index;

    @Singular
    List<Stop> stops;

    double totalDistanceMiles;

    Double estimatedDurationMinutes;

    /**
     * Name of the solver that produced the visiting order.
     */
    String solver;

    /**
     * True when a lower-priority solver had to be used.
     */
    boolean degraded;

    public boolean isRoundTrip() {
        return !stops.isEmpty() && stops.get(0).isDepot();
    }

    /**
     * Number of deliveries, excluding depot stops.
     */
    public int deliveryCount() {
        return (int) stops.stream().filter(stop -> !stop.isDepot()).count();
    }
}
