// =============================================================================
// AidRoute - Export Bundle
// =============================================================================
package com.aidroute.router.service.export;

import java.util.List;

/**
 * Everything produced by one export: a GPX file per route plus the manifest
 * in plain-text and structured form.
 */
public record ExportBundle(List<GpxDocument> gpxFiles, String manifestText, RouteManifest manifest,
                           byte[] manifestJson) {

    public ExportBundle {
        gpxFiles = List.copyOf(gpxFiles);
    }
}
