// =============================================================================
// AidRoute - Routing Configuration Properties
// =============================================================================
package com.aidroute.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the routing service.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    private Geocoder geocoder = new Geocoder();

    private TripSolver tripSolver = new TripSolver();

    private Optimizer optimizer = new Optimizer();

    private Clustering clustering = new Clustering();

    private Export export = new Export();

    @Data
    public static class Geocoder {

        /**
         * Nominatim-compatible search endpoint.
         */
        private String baseUrl = "https://nominatim.openstreetmap.org";

        /**
         * Identifying User-Agent; the public Nominatim policy rejects anonymous clients.
         */
        private String userAgent = "aidroute-delivery-router/1.0";

        /**
         * Per-request timeout.
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Minimum spacing between outbound requests. Clamped to one second.
         */
        private Duration minRequestInterval = Duration.ofMillis(1100);

        /**
         * Retries for timeouts, connection failures and 5xx/429 responses.
         */
        private int maxRetries = 2;

        /**
         * Base retry delay, doubled after each attempt.
         */
        private Duration retryBackoff = Duration.ofSeconds(1);

        /**
         * Upper bound on address variations tried per address, including the verbatim text.
         */
        private int maxVariations = 7;

        /**
         * Candidates requested per query.
         */
        private int candidateLimit = 5;

        /**
         * Optional comma-separated ISO country codes to restrict matches.
         */
        private String countryCodes;
    }

    @Data
    public static class TripSolver {

        private boolean enabled = true;

        /**
         * OSRM-compatible trip service.
         */
        private String baseUrl = "https://router.project-osrm.org";

        private String profile = "driving";

        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Optimizer {

        private int defaultMaxStopsPerRoute = 4;

        /**
         * Average speed in mph for locally estimated durations.
         */
        private double averageSpeedMph = 25;

        /**
         * Threads used to optimize clusters concurrently.
         */
        private int workerThreads = 4;

        /**
         * Overall budget for optimizing one request's clusters.
         */
        private Duration requestDeadline = Duration.ofSeconds(120);
    }

    @Data
    public static class Clustering {

        private ClusteringStrategy strategy = ClusteringStrategy.GREEDY;
    }

    @Data
    public static class Export {

        /**
         * GPX {@code creator} attribute.
         */
        private String creator = "AidRoute Delivery Router";

        /**
         * Label for the depot when it has no display name.
         */
        private String depotName = "Depot";
    }

    public enum ClusteringStrategy {
        GREEDY,
        CENTROID
    }
}
