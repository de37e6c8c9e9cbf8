// =============================================================================
// AidRoute - Routing Configuration
// =============================================================================
package com.aidroute.router.config;

import com.aidroute.router.service.cluster.CentroidPartitionClusterer;
import com.aidroute.router.service.cluster.Clusterer;
import com.aidroute.router.service.cluster.GreedyProximityClusterer;
import com.aidroute.router.service.geocode.GeocodingProvider;
import com.aidroute.router.service.geocode.NominatimGeocodingProvider;
import com.aidroute.router.service.geocode.RateGate;
import com.aidroute.router.service.geocode.Sleeper;
import com.aidroute.router.service.solver.NearestNeighborRouteSolver;
import com.aidroute.router.service.solver.TripServiceRouteSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline components from {@link RoutingProperties}.
 */
@Slf4j
@Configuration
public class RoutingConfiguration {

    static final Duration MIN_GEOCODER_INTERVAL = Duration.ofSeconds(1);

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    /**
     * Process-wide gate for the geocoding provider. The configured interval is
     * never allowed below one second.
     */
    @Bean
    public RateGate geocoderRateGate(RoutingProperties properties, Sleeper sleeper) {
        Duration interval = properties.getGeocoder().getMinRequestInterval();
        if (interval == null || interval.compareTo(MIN_GEOCODER_INTERVAL) < 0) {
            log.warn("Geocoder min-request-interval {} below {}, clamping", interval, MIN_GEOCODER_INTERVAL);
            interval = MIN_GEOCODER_INTERVAL;
        }
        return new RateGate(interval, System::nanoTime, sleeper);
    }

    @Bean
    public GeocodingProvider geocodingProvider(WebClient.Builder webClientBuilder, RoutingProperties properties) {
        return new NominatimGeocodingProvider(webClientBuilder.clone(), properties.getGeocoder());
    }

    @Bean
    @Order(1)
    public TripServiceRouteSolver tripServiceRouteSolver(WebClient.Builder webClientBuilder,
                                                         RoutingProperties properties) {
        return new TripServiceRouteSolver(webClientBuilder.clone(), properties.getTripSolver());
    }

    @Bean
    @Order(2)
    public NearestNeighborRouteSolver nearestNeighborRouteSolver(RoutingProperties properties) {
        return new NearestNeighborRouteSolver(properties.getOptimizer().getAverageSpeedMph());
    }

    @Bean
    public Clusterer clusterer(RoutingProperties properties) {
        RoutingProperties.ClusteringStrategy strategy = properties.getClustering().getStrategy();
        log.info("Clustering strategy: {}", strategy);
        return switch (strategy) {
            case CENTROID -> new CentroidPartitionClusterer();
            case GREEDY -> new GreedyProximityClusterer();
        };
    }

    @Bean(name = "routeOptimizerExecutor", destroyMethod = "shutdown")
    public ExecutorService routeOptimizerExecutor(RoutingProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "route-optimizer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getOptimizer().getWorkerThreads()), threadFactory);
    }
}
