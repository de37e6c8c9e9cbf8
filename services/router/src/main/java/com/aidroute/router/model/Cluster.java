// =============================================================================
// AidRoute - Cluster
// =============================================================================
package com.aidroute.router.model;

import java.util.List;

/**
 * Bounded group of matched stops assigned to a single route.
 *
 * @param id      1-based cluster number, becomes the route index
 * @param members stops in the order they were added, never empty
 * @param anchor  depot, or {@code null} when routes are open-ended
 */
public record Cluster(int id, List<GeocodeResult> members, Depot anchor) {

    public Cluster {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Cluster " + id + " has no members");
        }
        members = List.copyOf(members);
    }

    public boolean hasDepot() {
        return anchor != null;
    }

    public int size() {
        return members.size();
    }
}
