// =============================================================================
// AidRoute - Manifest Writer
// =============================================================================
package com.aidroute.router.service.export;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link RouteManifest} as the bilingual plain-text summary handed to
 * drivers.
 */
class ManifestWriter {

    private static final String HEAVY_RULE = "=".repeat(70);
    private static final String LIGHT_RULE = "-".repeat(70);

    String write(RouteManifest manifest) {
        List<String> lines = new ArrayList<>();
        lines.add(HEAVY_RULE);
        lines.add("DELIVERY ROUTE MANIFEST / MANIFIESTO DE RUTAS DE ENTREGA");
        lines.add(HEAVY_RULE);
        lines.add("");

        if (manifest.getDepotAddress() != null) {
            lines.add("Depot: " + manifest.getDepotAddress());
            lines.add("");
        }

        lines.add("Total Routes: " + manifest.getTotalRoutes());
        lines.add("Total Stops: " + manifest.getTotalStops());
        if (manifest.getTotalDistanceMiles() > 0) {
            lines.add(String.format(Locale.ROOT, "Total Distance: %.1f miles", manifest.getTotalDistanceMiles()));
        }
        lines.add("");
        lines.add(LIGHT_RULE);
        lines.add("");

        for (RouteManifest.RouteEntry route : manifest.getRoutes()) {
            lines.add("ROUTE " + route.getRouteNumber() + (route.isDegraded() ? " (fallback ordering)" : ""));
            lines.add("File: " + route.getFileName());
            lines.add("Stops: " + route.getStopCount());
            if (route.getTotalDistanceMiles() > 0) {
                lines.add(String.format(Locale.ROOT, "Distance: %.1f miles", route.getTotalDistanceMiles()));
            }
            if (route.getEstimatedDurationMinutes() != null && route.getEstimatedDurationMinutes() > 0) {
                lines.add(String.format(Locale.ROOT, "Est. Duration: %.0f min", route.getEstimatedDurationMinutes()));
            }
            lines.add("");

            for (RouteManifest.StopEntry stop : route.getStops()) {
                lines.add("  " + stop.getSequence() + ". " + stop.getName());
                lines.add("     " + stop.getAddress());
                lines.add("     Phone: " + PhoneFormat.display(stop.getPhone()));
                if (stop.getHouseholdSize() != null && !stop.getHouseholdSize().isBlank()) {
                    lines.add("     Household: " + stop.getHouseholdSize().trim());
                }
                if (stop.getItemsNeeded() != null && !stop.getItemsNeeded().isBlank()) {
                    lines.add("     Items: " + stop.getItemsNeeded().trim());
                }
                if (stop.getSpecialItems() != null && !stop.getSpecialItems().isBlank()) {
                    lines.add("     Special: " + stop.getSpecialItems().trim());
                }
                if (stop.getNotes() != null && !stop.getNotes().isBlank()) {
                    lines.add("     Notes: " + stop.getNotes().trim());
                }
                lines.add("");
            }
            lines.add(LIGHT_RULE);
            lines.add("");
        }

        if (manifest.getFailures() != null && !manifest.getFailures().isEmpty()) {
            lines.add("UNROUTED CLUSTERS / GRUPOS SIN RUTA");
            for (RouteManifest.FailureEntry failure : manifest.getFailures()) {
                lines.add("  Cluster " + failure.getClusterId() + ": " + failure.getCode() + " " + failure.getMessage());
                failure.getAddresses().forEach(address -> lines.add("     " + address));
            }
            lines.add("");
        }

        if (manifest.getUnroutable() != null && !manifest.getUnroutable().isEmpty()) {
            lines.add("NOT GEOCODED / DIRECCIONES NO ENCONTRADAS");
            for (RouteManifest.UnroutableEntry entry : manifest.getUnroutable()) {
                lines.add("  " + entry.getAddress() + " [" + entry.getStatus() + "]"
                        + (entry.getError() != null ? " " + entry.getError() : ""));
            }
            lines.add("");
        }

        return String.join("\n", lines);
    }
}
