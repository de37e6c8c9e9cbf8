// =============================================================================
// AidRoute - Cluster Failure
// =============================================================================
package com.aidroute.router.model;

import com.aidroute.router.error.RoutingErrorCode;

import java.util.List;

/**
 * A cluster for which no solver could produce a route.
 */
public record ClusterFailure(int clusterId, RoutingErrorCode code, String message, List<GeocodeResult> members) {

    public ClusterFailure {
        members = List.copyOf(members);
    }
}
