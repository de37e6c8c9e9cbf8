// =============================================================================
// AidRoute - Error Response DTO
// =============================================================================
package com.aidroute.router.dto;

import java.time.Instant;

/**
 * Error body returned for every failed request.
 */
public record ErrorResponse(String code, String message, Instant timestamp) {
}
