// =============================================================================
// AidRoute - Test Locations
// =============================================================================
package com.aidroute.router;

import com.aidroute.router.model.Address;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.Depot;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.StopDetails;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared fixtures around downtown Minneapolis.
 */
public final class TestLocations {

    public static final Coordinate DEPOT = Coordinate.of(44.9778, -93.2650);

    private TestLocations() {
    }

    public static GeocodeResult matched(String address, double latitude, double longitude) {
        return GeocodeResult.matched(Address.of(address), address, Coordinate.of(latitude, longitude));
    }

    public static GeocodeResult matched(String address, String name, String phone, double latitude, double longitude) {
        Address query = Address.builder()
                .text(address)
                .details(StopDetails.builder().name(name).phone(phone).build())
                .build();
        return GeocodeResult.matched(query, address, Coordinate.of(latitude, longitude));
    }

    public static Depot depot() {
        return new Depot(GeocodeResult.matched(Address.of("100 Depot Rd, Minneapolis, MN"), "Depot", DEPOT));
    }

    /**
     * Stops on a line heading north from the depot, {@code spacing} degrees of
     * latitude apart, the first one {@code spacing} from the depot.
     */
    public static List<GeocodeResult> lineNorthOfDepot(int count, double spacing) {
        List<GeocodeResult> stops = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            stops.add(matched("Stop " + i, DEPOT.latitude() + i * spacing, DEPOT.longitude()));
        }
        return stops;
    }
}
