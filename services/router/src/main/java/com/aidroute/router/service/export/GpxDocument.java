// =============================================================================
// AidRoute - GPX Document
// =============================================================================
package com.aidroute.router.service.export;

import java.nio.charset.StandardCharsets;

/**
 * Serialized GPX file for one route.
 */
public record GpxDocument(int routeIndex, String fileName, byte[] content) {

    public static String fileNameFor(int routeIndex) {
        return String.format("route_%02d.gpx", routeIndex);
    }

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
