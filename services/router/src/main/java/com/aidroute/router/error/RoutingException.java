// =============================================================================
// AidRoute - Routing Exception
// =============================================================================
package com.aidroute.router.error;

import lombok.Getter;

/**
 * Request-level failure of the routing pipeline.
 */
@Getter
public class RoutingException extends RuntimeException {

    private final RoutingErrorCode code;

    public RoutingException(RoutingErrorCode code) {
        this(code, code.getDefaultMessage());
    }

    public RoutingException(RoutingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RoutingException(RoutingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
