// =============================================================================
// AidRoute - Route Exporter Tests
// =============================================================================
package com.aidroute.router.service.export;

import com.aidroute.router.TestLocations;
import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.model.Address;
import com.aidroute.router.model.ClusterFailure;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.Depot;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.GeocodeStatus;
import com.aidroute.router.model.Route;
import com.aidroute.router.model.RouteSet;
import com.aidroute.router.model.Stop;
import com.aidroute.router.model.StopDetails;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RouteExporterTest {

    private static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RouteExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new RouteExporter(objectMapper, new RoutingProperties());
    }

    @Test
    @DisplayName("Exporting the same route set twice gives identical bytes")
    void deterministic() {
        RouteSet routeSet = sampleRouteSet();

        ExportBundle first = exporter.export(routeSet);
        ExportBundle second = exporter.export(routeSet);

        assertThat(first.gpxFiles()).hasSameSizeAs(second.gpxFiles());
        for (int i = 0; i < first.gpxFiles().size(); i++) {
            assertThat(first.gpxFiles().get(i).content()).isEqualTo(second.gpxFiles().get(i).content());
        }
        assertThat(first.manifestText()).isEqualTo(second.manifestText());
        assertThat(first.manifestJson()).isEqualTo(second.manifestJson());
        assertThat(exporter.archive(first)).isEqualTo(exporter.archive(second));
    }

    @Test
    @DisplayName("GPX coordinates re-import without drift")
    void reimportCoordinates() throws Exception {
        RouteSet routeSet = sampleRouteSet();
        Route route = routeSet.routes().get(0);

        Document gpx = parse(exporter.export(routeSet).gpxFiles().get(0).content());

        NodeList points = gpx.getElementsByTagNameNS(GPX_NAMESPACE, "trkpt");
        assertThat(points.getLength()).isEqualTo(route.getStops().size());
        for (int i = 0; i < points.getLength(); i++) {
            Element point = (Element) points.item(i);
            Stop stop = route.getStops().get(i);
            assertThat(Double.parseDouble(point.getAttribute("lat"))).isCloseTo(stop.coordinate().latitude(), within(1e-7));
            assertThat(Double.parseDouble(point.getAttribute("lon"))).isCloseTo(stop.coordinate().longitude(), within(1e-7));
        }
        assertThat(gpx.getElementsByTagNameNS(GPX_NAMESPACE, "wpt").getLength()).isEqualTo(route.getStops().size());
        assertThat(gpx.getDocumentElement().getAttribute("version")).isEqualTo("1.1");
        assertThat(gpx.getDocumentElement().getAttribute("creator")).isEqualTo("AidRoute Delivery Router");
    }

    @Test
    @DisplayName("Waypoints label the depot and number the deliveries")
    void waypointLabels() throws Exception {
        Document gpx = parse(exporter.export(sampleRouteSet()).gpxFiles().get(0).content());

        NodeList waypoints = gpx.getElementsByTagNameNS(GPX_NAMESPACE, "wpt");
        List<String> names = new ArrayList<>();
        for (int i = 0; i < waypoints.getLength(); i++) {
            names.add(((Element) waypoints.item(i)).getElementsByTagNameNS(GPX_NAMESPACE, "name")
                    .item(0).getTextContent());
        }
        assertThat(names).containsExactly(
                "START: 100 Depot Rd, Minneapolis, MN",
                "1. Tom & Jerry <Bakery>",
                "2. 20 Second St, Minneapolis, MN",
                "END: 100 Depot Rd, Minneapolis, MN");

        String description = ((Element) waypoints.item(1)).getElementsByTagNameNS(GPX_NAMESPACE, "desc")
                .item(0).getTextContent();
        assertThat(description)
                .contains("Phone: (612) 555-0100")
                .contains("Household: 4")
                .contains("Special: Diapers \"size 4\"")
                .contains("Notes: Ring twice");
    }

    @Test
    @DisplayName("Reserved and control characters are escaped into well-formed XML")
    void escaping() throws Exception {
        assertThat(GpxWriter.escape("a&b<c>d\"e'f")).isEqualTo("a&amp;b&lt;c&gt;d&quot;e&apos;f");
        assertThat(GpxWriter.escape("bell\u0007tab\t")).isEqualTo("bell tab\t");

        GeocodeResult weird = GeocodeResult.matched(Address.builder()
                        .text("1 Odd St")
                        .details(StopDetails.builder().name("Null\u0000Byte ]]> <![CDATA[").build())
                        .build(),
                "1 Odd St", TestLocations.DEPOT);
        Route route = Route.builder()
                .index(1)
                .stop(Stop.builder().sequenceNumber(0).location(weird).build())
                .build();

        byte[] gpx = exporter.export(RouteSet.of(List.of(route))).gpxFiles().get(0).content();

        assertThat(parse(gpx).getElementsByTagNameNS(GPX_NAMESPACE, "wpt").getLength()).isEqualTo(1);
    }

    @Test
    @DisplayName("Files are named route_NN.gpx by route number")
    void fileNames() {
        ExportBundle bundle = exporter.export(sampleRouteSet());

        assertThat(bundle.gpxFiles()).extracting(GpxDocument::fileName)
                .containsExactly("route_01.gpx", "route_02.gpx");
        assertThat(GpxDocument.fileNameFor(12)).isEqualTo("route_12.gpx");
    }

    @Test
    @DisplayName("Text manifest lists routes, stops, failures and unroutable addresses")
    void textManifest() {
        String text = exporter.export(sampleRouteSet()).manifestText();

        assertThat(text)
                .contains("DELIVERY ROUTE MANIFEST / MANIFIESTO DE RUTAS DE ENTREGA")
                .contains("Depot: 100 Depot Rd, Minneapolis, MN")
                .contains("Total Routes: 2")
                .contains("Total Stops: 3")
                .contains("ROUTE 1")
                .contains("ROUTE 2 (fallback ordering)")
                .contains("  1. Tom & Jerry <Bakery>")
                .contains("     Phone: (612) 555-0100")
                .contains("     Phone: N/A")
                .contains("     Household: 4")
                .contains("     Items: Rice, beans")
                .contains("Cluster 3: OPTIMIZE_PROVIDER_ERROR")
                .contains("999 Nowhere Ln [NO_MATCH] Not found")
                .doesNotContain("Generated");
    }

    @Test
    @DisplayName("JSON manifest carries route assignments per recipient")
    void jsonManifest() throws Exception {
        byte[] json = exporter.export(sampleRouteSet()).manifestJson();
        JsonNode manifest = objectMapper.readTree(json);

        assertThat(manifest.get("depotAddress").asText()).isEqualTo("100 Depot Rd, Minneapolis, MN");
        assertThat(manifest.get("totalRoutes").asInt()).isEqualTo(2);
        assertThat(manifest.get("totalStops").asInt()).isEqualTo(3);
        JsonNode firstStop = manifest.get("routes").get(0).get("stops").get(0);
        assertThat(firstStop.get("sequence").asInt()).isEqualTo(1);
        assertThat(firstStop.get("name").asText()).isEqualTo("Tom & Jerry <Bakery>");
        assertThat(firstStop.get("phone").asText()).isEqualTo("612-555-0100");
        assertThat(firstStop.get("householdSize").asText()).isEqualTo("4");
        assertThat(firstStop.get("itemsNeeded").asText()).isEqualTo("Rice, beans");
        assertThat(manifest.get("routes").get(1).get("degraded").asBoolean()).isTrue();
        assertThat(manifest.get("failures").get(0).get("addresses").get(0).asText()).isEqualTo("Stop 9");
        assertThat(manifest.get("unroutable").get(0).get("status").asText()).isEqualTo("NO_MATCH");
        assertThat(new String(json, StandardCharsets.UTF_8))
                .startsWith("{\n  \"")
                .doesNotContain("\r");
    }

    @Test
    @DisplayName("Archive holds every GPX file and both manifests")
    void archive() throws Exception {
        byte[] zip = exporter.archive(exporter.export(sampleRouteSet()));

        List<String> entries = new ArrayList<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.add(entry.getName());
            }
        }
        assertThat(entries).containsExactly(
                "route_01.gpx", "route_02.gpx", RouteExporter.MANIFEST_TEXT_FILE, RouteExporter.MANIFEST_JSON_FILE);
    }

    @Test
    @DisplayName("Route without stops cannot be exported")
    void emptyRoute() {
        Route empty = Route.builder().index(1).build();

        assertThatThrownBy(() -> exporter.export(RouteSet.of(List.of(empty))))
                .isInstanceOfSatisfying(ExportSerializationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(RoutingErrorCode.EXPORT_SERIALIZATION_ERROR));
    }

    @Test
    @DisplayName("Phone numbers display in North American format")
    void phoneFormat() {
        assertThat(PhoneFormat.display("612.555.0100")).isEqualTo("(612) 555-0100");
        assertThat(PhoneFormat.display("+1 612 555 0100")).isEqualTo("(612) 555-0100");
        assertThat(PhoneFormat.display("555-0100")).isEqualTo("555-0100");
        assertThat(PhoneFormat.display(" ")).isEqualTo("N/A");
    }

    private static Document parse(byte[] xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml));
    }

    private static RouteSet sampleRouteSet() {
        Depot depot = TestLocations.depot();
        GeocodeResult bakery = GeocodeResult.matched(Address.builder()
                        .text("10 First St, Minneapolis, MN")
                        .details(StopDetails.builder()
                                .name("Tom & Jerry <Bakery>")
                                .phone("612-555-0100")
                                .householdSize("4")
                                .itemsNeeded("Rice, beans")
                                .specialItems("Diapers \"size 4\"")
                                .notes("Ring twice")
                                .build())
                        .build(),
                "10 First Street, Minneapolis", TestLocations.DEPOT);
        GeocodeResult second = TestLocations.matched("20 Second St, Minneapolis, MN", 44.99, -93.27);
        GeocodeResult third = TestLocations.matched("30 Third St, Minneapolis, MN", 45.01, -93.25);

        Route first = Route.builder()
                .index(1)
                .stop(depotStop(depot, 0))
                .stop(Stop.builder().sequenceNumber(1).location(withCoordinate(bakery, 44.98, -93.26)).build())
                .stop(Stop.builder().sequenceNumber(2).location(second).distanceFromStartMiles(0.9).build())
                .stop(depotStop(depot, 3))
                .totalDistanceMiles(2.5)
                .estimatedDurationMinutes(6.0)
                .solver("osrm-trip")
                .build();
        Route fallback = Route.builder()
                .index(2)
                .stop(depotStop(depot, 0))
                .stop(Stop.builder().sequenceNumber(1).location(third).distanceFromStartMiles(2.3).build())
                .stop(depotStop(depot, 2))
                .totalDistanceMiles(6.21)
                .estimatedDurationMinutes(14.9)
                .solver("nearest-neighbor")
                .degraded(true)
                .build();

        ClusterFailure failure = new ClusterFailure(3, RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR, "No route",
                List.of(TestLocations.matched("Stop 9", 45.1, -93.3)));
        GeocodeResult unroutable = GeocodeResult.failed(Address.of("999 Nowhere Ln"), GeocodeStatus.NO_MATCH,
                "Not found");

        return new RouteSet(List.of(first, fallback), List.of(failure), List.of(unroutable), depot);
    }

    private static GeocodeResult withCoordinate(GeocodeResult result, double latitude, double longitude) {
        return result.toBuilder()
                .coordinate(Coordinate.of(latitude, longitude))
                .build();
    }

    private static Stop depotStop(Depot depot, int sequence) {
        return Stop.builder().sequenceNumber(sequence).location(depot.location()).depot(true).build();
    }
}
