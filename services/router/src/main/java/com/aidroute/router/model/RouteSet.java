// =============================================================================
// AidRoute - Route Set
// =============================================================================
package com.aidroute.router.model;

import java.util.List;

/**
 * All routes produced for one request, in cluster order, together with the
 * clusters that could not be routed and the inputs that never reached
 * clustering because they failed geocoding.
 */
public record RouteSet(List<Route> routes, List<ClusterFailure> failures, List<GeocodeResult> unroutable, Depot depot) {

    public RouteSet {
        routes = List.copyOf(routes);
        failures = List.copyOf(failures);
        unroutable = List.copyOf(unroutable);
    }

    public static RouteSet of(List<Route> routes) {
        return new RouteSet(routes, List.of(), List.of(), null);
    }

    public int totalDeliveries() {
        return routes.stream().mapToInt(Route::deliveryCount).sum();
    }

    public double totalDistanceMiles() {
        return routes.stream().mapToDouble(Route::getTotalDistanceMiles).sum();
    }
}
