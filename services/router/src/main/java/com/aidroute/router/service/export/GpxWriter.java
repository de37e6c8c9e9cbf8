// =============================================================================
// AidRoute - GPX Writer
// =============================================================================
package com.aidroute.router.service.export;

import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.Route;
import com.aidroute.router.model.Stop;
import com.aidroute.router.model.StopDetails;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes a {@link Route} as a GPX 1.1 document: route metadata, one waypoint
 * per stop and a single track through the stops in visiting order.
 *
 * <p>Output depends only on the route: no timestamps, no randomness, fixed
 * number formatting.
 */
class GpxWriter {

    private static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";
    private static final String DELIVERY_SYMBOL = "Flag, Green";
    private static final String DEPOT_SYMBOL = "Flag, Blue";

    private final String creator;
    private final String defaultDepotName;

    GpxWriter(String creator, String defaultDepotName) {
        this.creator = creator;
        this.defaultDepotName = defaultDepotName;
    }

    byte[] write(Route route) {
        if (route.getStops().isEmpty()) {
            throw new ExportSerializationException("Route " + route.getIndex() + " has no stops");
        }

        StringBuilder xml = new StringBuilder(1024);
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<gpx version=\"1.1\" creator=\"").append(escape(creator))
                .append("\" xmlns=\"").append(GPX_NAMESPACE).append("\">\n");

        xml.append("  <metadata>\n");
        element(xml, 4, "name", "Delivery Route " + route.getIndex());
        element(xml, 4, "desc", describe(route));
        xml.append("  </metadata>\n");

        int delivery = 0;
        boolean seenDepot = false;
        for (Stop stop : route.getStops()) {
            String name;
            String description;
            String symbol;
            if (stop.isDepot()) {
                name = (seenDepot ? "END: " : "START: ") + depotLabel(stop);
                description = seenDepot ? "Return point / Punto de regreso" : "Departure point / Punto de salida";
                symbol = DEPOT_SYMBOL;
                seenDepot = true;
            } else {
                delivery++;
                name = delivery + ". " + stopLabel(stop);
                description = deliveryDescription(stop);
                symbol = DELIVERY_SYMBOL;
            }
            xml.append("  <wpt ").append(position(stop.coordinate())).append(">\n");
            element(xml, 4, "name", name);
            element(xml, 4, "desc", description);
            element(xml, 4, "sym", symbol);
            xml.append("  </wpt>\n");
        }

        xml.append("  <trk>\n");
        element(xml, 4, "name", "Route " + route.getIndex() + " Track");
        xml.append("    <trkseg>\n");
        for (Stop stop : route.getStops()) {
            xml.append("      <trkpt ").append(position(stop.coordinate())).append("/>\n");
        }
        xml.append("    </trkseg>\n");
        xml.append("  </trk>\n");
        xml.append("</gpx>\n");

        return xml.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String describe(Route route) {
        return String.format(Locale.ROOT, "Route with %d stops, %.1f miles",
                route.deliveryCount(), route.getTotalDistanceMiles());
    }

    private String depotLabel(Stop stop) {
        String label = stop.getLocation().getQuery().label();
        return label == null || label.isBlank() ? defaultDepotName : label;
    }

    static String stopLabel(Stop stop) {
        StopDetails details = stop.getLocation().getQuery().getDetails();
        if (details != null && details.getName() != null && !details.getName().isBlank()) {
            return details.getName().trim();
        }
        return stop.getLocation().getQuery().label();
    }

    private static String deliveryDescription(Stop stop) {
        List<String> lines = new ArrayList<>();
        lines.add(stop.getLocation().getQuery().label());
        StopDetails details = stop.getLocation().getQuery().getDetails();
        lines.add("Phone: " + PhoneFormat.display(details == null ? null : details.getPhone()));
        if (details != null) {
            if (details.getHouseholdSize() != null && !details.getHouseholdSize().isBlank()) {
                lines.add("Household: " + details.getHouseholdSize().trim());
            }
            if (details.getSpecialItems() != null && !details.getSpecialItems().isBlank()) {
                lines.add("Special: " + details.getSpecialItems().trim());
            }
            if (details.getNotes() != null && !details.getNotes().isBlank()) {
                lines.add("Notes: " + details.getNotes().trim());
            }
        }
        return String.join("\n", lines);
    }

    private static String position(Coordinate coordinate) {
        return String.format(Locale.ROOT, "lat=\"%.7f\" lon=\"%.7f\"", coordinate.latitude(), coordinate.longitude());
    }

    private static void element(StringBuilder xml, int indent, String tag, String text) {
        xml.append(" ".repeat(indent))
                .append('<').append(tag).append('>')
                .append(escape(text))
                .append("</").append(tag).append(">\n");
    }

    /**
     * Escapes the five XML reserved characters and replaces characters that
     * XML 1.0 does not allow with a space.
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> {
                    if (c < 0x20 && c != '\t' && c != '\n' && c != '\r' || c == 0xFFFE || c == 0xFFFF) {
                        out.append(' ');
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }
}
