// =============================================================================
// AidRoute - Export Serialization Exception
// =============================================================================
package com.aidroute.router.service.export;

import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.error.RoutingException;

public class ExportSerializationException extends RoutingException {

    public ExportSerializationException(String message) {
        super(RoutingErrorCode.EXPORT_SERIALIZATION_ERROR, message);
    }

    public ExportSerializationException(String message, Throwable cause) {
        super(RoutingErrorCode.EXPORT_SERIALIZATION_ERROR, message, cause);
    }
}
