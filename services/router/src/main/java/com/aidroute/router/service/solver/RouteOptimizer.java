// =============================================================================
// AidRoute - Route Optimizer
// =============================================================================
package com.aidroute.router.service.solver;

import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.ClusterFailure;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.Route;
import com.aidroute.router.model.RouteSet;
import com.aidroute.router.model.Stop;
import com.aidroute.router.service.distance.DistanceCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns clusters into routes by trying each {@link RouteSolver} in priority
 * order until one produces a valid visiting order.
 *
 * <p>Clusters are optimized concurrently and independently: a slow or failing
 * external call for one cluster never affects another. Results are returned
 * in cluster order regardless of completion order. Clusters still running when
 * the request deadline expires are finished with local solvers only.
 */
@Slf4j
@Service
public class RouteOptimizer {

    private final List<RouteSolver> solvers;
    private final ExecutorService executor;
    private final RoutingProperties properties;

    public RouteOptimizer(List<RouteSolver> solvers,
                          @Qualifier("routeOptimizerExecutor") ExecutorService executor,
                          RoutingProperties properties) {
        this.solvers = List.copyOf(solvers);
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Optimize every cluster.
     *
     * @param clusters      clusters in index order
     * @param useTripSolver {@code false} to skip external solvers for this request
     * @return routes and per-cluster failures, both in cluster order
     */
    public RouteSet optimize(List<Cluster> clusters, boolean useTripSolver) {
        long startTime = System.currentTimeMillis();
        log.info("Starting route optimization: clusters={}, useTripSolver={}", clusters.size(), useTripSolver);

        List<CompletableFuture<ClusterOutcome>> futures = new ArrayList<>(clusters.size());
        for (Cluster cluster : clusters) {
            futures.add(CompletableFuture.supplyAsync(() -> optimizeCluster(cluster, useTripSolver), executor));
        }

        awaitDeadline(futures);

        List<Route> routes = new ArrayList<>();
        List<ClusterFailure> failures = new ArrayList<>();
        for (int i = 0; i < clusters.size(); i++) {
            CompletableFuture<ClusterOutcome> future = futures.get(i);
            ClusterOutcome outcome;
            if (future.isDone() && !future.isCompletedExceptionally()) {
                outcome = future.join();
            } else {
                future.cancel(false);
                log.warn("Cluster {} missed the request deadline, finishing locally", clusters.get(i).id());
                outcome = optimizeCluster(clusters.get(i), false);
                if (outcome.route() != null) {
                    outcome = new ClusterOutcome(outcome.route().toBuilder().degraded(true).build(), null);
                }
            }
            if (outcome.route() != null) {
                routes.add(outcome.route());
            } else {
                failures.add(outcome.failure());
            }
        }

        log.info("Route optimization complete: routes={}, failures={}, distance={}mi, elapsedMs={}",
                routes.size(), failures.size(),
                String.format("%.2f", routes.stream().mapToDouble(Route::getTotalDistanceMiles).sum()),
                System.currentTimeMillis() - startTime);

        return new RouteSet(routes, failures, List.of(), clusters.isEmpty() ? null : clusters.get(0).anchor());
    }

    /**
     * Optimize a single cluster, falling back through the solver chain.
     */
    ClusterOutcome optimizeCluster(Cluster cluster, boolean useTripSolver) {
        RouteSolverException lastFailure = null;
        boolean degraded = false;

        for (RouteSolver solver : solvers) {
            if (!solver.isEnabled() || (solver.isExternal() && !useTripSolver)) {
                continue;
            }
            try {
                RouteSolution solution = solver.solve(cluster);
                Route route = buildRoute(cluster, solution, solver.name(), degraded);
                log.debug("Cluster {} solved by {}: stops={}, distance={}mi",
                        cluster.id(), solver.name(), route.getStops().size(), route.getTotalDistanceMiles());
                return new ClusterOutcome(route, null);
            } catch (RouteSolverException e) {
                log.warn("Solver {} failed for cluster {}: {}", solver.name(), cluster.id(), e.getMessage());
                lastFailure = e;
                degraded = true;
            } catch (RuntimeException e) {
                log.warn("Solver {} crashed for cluster {}", solver.name(), cluster.id(), e);
                lastFailure = new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR, e.getMessage(), e);
                degraded = true;
            }
        }

        RoutingErrorCode code = lastFailure != null ? lastFailure.getCode() : RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR;
        String message = lastFailure != null ? lastFailure.getMessage() : "No route solver enabled";
        log.warn("Cluster {} could not be routed: code={}, reason={}", cluster.id(), code, message);
        return new ClusterOutcome(null, new ClusterFailure(cluster.id(), code, message, cluster.members()));
    }

    /**
     * Assemble the route and check that the order visits every member exactly once.
     */
    static Route buildRoute(Cluster cluster, RouteSolution solution, String solverName, boolean degraded)
            throws RouteSolverException {
        List<GeocodeResult> members = cluster.members();
        List<Integer> order = solution.visitOrder();
        boolean[] seen = new boolean[members.size()];
        if (order.size() != members.size()) {
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                    "Order has " + order.size() + " stops for " + members.size() + " members");
        }
        for (Integer index : order) {
            if (index == null || index < 0 || index >= members.size() || seen[index]) {
                throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR,
                        "Order is not a permutation of the cluster members");
            }
            seen[index] = true;
        }
        if (!Double.isFinite(solution.distanceMiles())) {
            throw new RouteSolverException(RoutingErrorCode.OPTIMIZE_PROVIDER_ERROR, "Non-finite route distance");
        }

        Coordinate start = cluster.hasDepot()
                ? cluster.anchor().coordinate()
                : members.get(order.get(0)).getCoordinate();

        Route.RouteBuilder builder = Route.builder()
                .index(cluster.id())
                .totalDistanceMiles(roundHundredths(Math.max(0, solution.distanceMiles())))
                .estimatedDurationMinutes(solution.durationMinutes() == null
                        ? null : roundHundredths(solution.durationMinutes()))
                .solver(solverName)
                .degraded(degraded);

        int sequence = 0;
        if (cluster.hasDepot()) {
            builder.stop(depotStop(cluster, sequence++));
        }
        for (Integer index : order) {
            GeocodeResult member = members.get(index);
            builder.stop(Stop.builder()
                    .sequenceNumber(sequence++)
                    .location(member)
                    .distanceFromStartMiles(roundHundredths(
                            DistanceCalculator.geodesicMiles(start, member.getCoordinate())))
                    .build());
        }
        if (cluster.hasDepot()) {
            builder.stop(depotStop(cluster, sequence));
        }
        return builder.build();
    }

    private static Stop depotStop(Cluster cluster, int sequence) {
        return Stop.builder()
                .sequenceNumber(sequence)
                .location(cluster.anchor().location())
                .depot(true)
                .distanceFromStartMiles(0)
                .build();
    }

    private void awaitDeadline(List<CompletableFuture<ClusterOutcome>> futures) {
        long deadlineMs = properties.getOptimizer().getRequestDeadline().toMillis();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Request deadline of {}ms reached with clusters pending", deadlineMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for cluster optimization");
        } catch (ExecutionException e) {
            // optimizeCluster never throws; a failed future is handled per cluster
            log.error("Unexpected cluster optimization failure", e.getCause());
        }
    }

    private static double roundHundredths(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    record ClusterOutcome(Route route, ClusterFailure failure) {
    }
}
