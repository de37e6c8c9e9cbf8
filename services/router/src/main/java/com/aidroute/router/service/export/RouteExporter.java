// =============================================================================
// AidRoute - Route Exporter
// =============================================================================
package com.aidroute.router.service.export;

import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.model.ClusterFailure;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.Route;
import com.aidroute.router.model.RouteSet;
import com.aidroute.router.model.Stop;
import com.aidroute.router.model.StopDetails;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Serializes a {@link RouteSet} into GPX files and manifests.
 *
 * <p>Exporting the same route set twice yields byte-identical output, archive
 * included.
 */
@Slf4j
@Service
public class RouteExporter {

    public static final String MANIFEST_TEXT_FILE = "manifest.txt";
    public static final String MANIFEST_JSON_FILE = "route_manifest.json";

    private static final LocalDateTime ENTRY_TIME = LocalDateTime.of(2000, 1, 1, 0, 0);

    private final ObjectWriter manifestJsonWriter;
    private final GpxWriter gpxWriter;
    private final ManifestWriter manifestWriter = new ManifestWriter();
    private final String depotName;

    public RouteExporter(ObjectMapper objectMapper, RoutingProperties properties) {
        // Fixed "\n" line endings keep the JSON identical across platforms
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        this.manifestJsonWriter = objectMapper.writer(new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter));
        this.depotName = properties.getExport().getDepotName();
        this.gpxWriter = new GpxWriter(properties.getExport().getCreator(), depotName);
    }

    /**
     * Export every route of the set.
     *
     * @throws ExportSerializationException if any document cannot be produced
     */
    public ExportBundle export(RouteSet routeSet) {
        List<GpxDocument> documents = new ArrayList<>(routeSet.routes().size());
        for (Route route : routeSet.routes()) {
            documents.add(new GpxDocument(route.getIndex(), GpxDocument.fileNameFor(route.getIndex()),
                    gpxWriter.write(route)));
        }

        RouteManifest manifest = buildManifest(routeSet);
        String manifestText = manifestWriter.write(manifest);
        byte[] manifestJson;
        try {
            manifestJson = manifestJsonWriter.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new ExportSerializationException("Could not serialize route manifest: " + e.getOriginalMessage(), e);
        }

        log.info("Export complete: gpxFiles={}, stops={}, failures={}, unroutable={}",
                documents.size(), manifest.getTotalStops(), routeSet.failures().size(), routeSet.unroutable().size());
        return new ExportBundle(documents, manifestText, manifest, manifestJson);
    }

    /**
     * Bundle an export into a ZIP archive with fixed entry timestamps.
     */
    public byte[] archive(ExportBundle bundle) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes, StandardCharsets.UTF_8)) {
            for (GpxDocument document : bundle.gpxFiles()) {
                writeEntry(zip, document.fileName(), document.content());
            }
            writeEntry(zip, MANIFEST_TEXT_FILE, bundle.manifestText().getBytes(StandardCharsets.UTF_8));
            writeEntry(zip, MANIFEST_JSON_FILE, bundle.manifestJson());
        } catch (IOException e) {
            throw new ExportSerializationException("Could not write export archive: " + e.getMessage(), e);
        }
        return bytes.toByteArray();
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setTimeLocal(ENTRY_TIME);
        zip.putNextEntry(entry);
        zip.write(content);
        zip.closeEntry();
    }

    private RouteManifest buildManifest(RouteSet routeSet) {
        List<RouteManifest.RouteEntry> routes = new ArrayList<>();
        for (Route route : routeSet.routes()) {
            List<RouteManifest.StopEntry> stops = new ArrayList<>();
            int sequence = 0;
            for (Stop stop : route.getStops()) {
                if (stop.isDepot()) {
                    continue;
                }
                StopDetails details = stop.getLocation().getQuery().getDetails();
                stops.add(RouteManifest.StopEntry.builder()
                        .sequence(++sequence)
                        .name(GpxWriter.stopLabel(stop))
                        .phone(details == null ? null : details.getPhone())
                        .address(stop.getLocation().getQuery().label())
                        .displayName(stop.getLocation().getDisplayName())
                        .latitude(stop.coordinate().latitude())
                        .longitude(stop.coordinate().longitude())
                        .distanceFromStartMiles(stop.getDistanceFromStartMiles())
                        .householdSize(details == null ? null : details.getHouseholdSize())
                        .itemsNeeded(details == null ? null : details.getItemsNeeded())
                        .specialItems(details == null ? null : details.getSpecialItems())
                        .notes(details == null ? null : details.getNotes())
                        .build());
            }
            routes.add(RouteManifest.RouteEntry.builder()
                    .routeNumber(route.getIndex())
                    .fileName(GpxDocument.fileNameFor(route.getIndex()))
                    .stopCount(stops.size())
                    .totalDistanceMiles(route.getTotalDistanceMiles())
                    .estimatedDurationMinutes(route.getEstimatedDurationMinutes())
                    .solver(route.getSolver())
                    .degraded(route.isDegraded())
                    .stops(stops)
                    .build());
        }

        List<RouteManifest.FailureEntry> failures = new ArrayList<>();
        for (ClusterFailure failure : routeSet.failures()) {
            failures.add(RouteManifest.FailureEntry.builder()
                    .clusterId(failure.clusterId())
                    .code(failure.code().name())
                    .message(failure.message())
                    .addresses(failure.members().stream().map(member -> member.getQuery().label()).toList())
                    .build());
        }

        List<RouteManifest.UnroutableEntry> unroutable = new ArrayList<>();
        for (GeocodeResult result : routeSet.unroutable()) {
            unroutable.add(RouteManifest.UnroutableEntry.builder()
                    .address(result.getQuery().label())
                    .status(result.getStatus().name())
                    .error(result.getErrorDetail())
                    .build());
        }

        return RouteManifest.builder()
                .depotAddress(routeSet.depot() == null ? null : depotLabel(routeSet))
                .totalRoutes(routes.size())
                .totalStops(routeSet.totalDeliveries())
                .totalDistanceMiles(Math.round(routeSet.totalDistanceMiles() * 100.0) / 100.0)
                .routes(routes)
                .failures(failures)
                .unroutable(unroutable)
                .build();
    }

    private String depotLabel(RouteSet routeSet) {
        String label = routeSet.depot().location().getQuery().label();
        return label == null || label.isBlank() ? depotName : label;
    }
}
