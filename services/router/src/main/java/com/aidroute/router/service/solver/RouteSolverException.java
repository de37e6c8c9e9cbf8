// =============================================================================
// AidRoute - Route Solver Exception
// =============================================================================
package com.aidroute.router.service.solver;

import com.aidroute.router.error.RoutingErrorCode;
import lombok.Getter;

@Getter
public class RouteSolverException extends Exception {

    private final RoutingErrorCode code;

    public RouteSolverException(RoutingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RouteSolverException(RoutingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
