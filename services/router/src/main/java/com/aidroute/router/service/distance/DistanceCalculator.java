// =============================================================================
// AidRoute - Distance Calculator
// =============================================================================
package com.aidroute.router.service.distance;

import com.aidroute.router.model.Coordinate;

/**
 * Ellipsoidal distances on the WGS-84 ellipsoid.
 *
 * <p>{@link #geodesicMiles} answers "how far apart are these points" and is
 * used for radius filtering only. {@link #roadMiles} approximates how far a
 * vehicle drives between them and is used for every routing decision.
 */
public final class DistanceCalculator {

    /**
     * Empirical ratio of road-network distance to straight-line distance.
     */
    public static final double ROAD_DISTANCE_MULTIPLIER = 1.35;

    public static final double METERS_PER_MILE = 1609.344;

    private static final double SEMI_MAJOR_AXIS_M = 6378137.0;
    private static final double FLATTENING = 1 / 298.257223563;
    private static final double SEMI_MINOR_AXIS_M = (1 - FLATTENING) * SEMI_MAJOR_AXIS_M;
    private static final double MEAN_RADIUS_M = 6371008.8;

    private static final int MAX_ITERATIONS = 200;
    private static final double CONVERGENCE_THRESHOLD = 1e-12;

    private DistanceCalculator() {
    }

    /**
     * Geodesic distance in statute miles (Vincenty inverse formula).
     */
    public static double geodesicMiles(Coordinate a, Coordinate b) {
        return geodesicMeters(a, b) / METERS_PER_MILE;
    }

    /**
     * Estimated driving distance in statute miles.
     */
    public static double roadMiles(Coordinate a, Coordinate b) {
        return geodesicMiles(a, b) * ROAD_DISTANCE_MULTIPLIER;
    }

    public static double geodesicMeters(Coordinate a, Coordinate b) {
        // Evaluate in a fixed point order so d(a,b) and d(b,a) are bit-identical
        if (compare(a, b) > 0) {
            Coordinate swap = a;
            a = b;
            b = swap;
        }
        if (a.latitude() == b.latitude() && a.longitude() == b.longitude()) {
            return 0.0;
        }

        double lon = Math.toRadians(b.longitude() - a.longitude());
        double u1 = Math.atan((1 - FLATTENING) * Math.tan(Math.toRadians(a.latitude())));
        double u2 = Math.atan((1 - FLATTENING) * Math.tan(Math.toRadians(b.latitude())));
        double sinU1 = Math.sin(u1);
        double cosU1 = Math.cos(u1);
        double sinU2 = Math.sin(u2);
        double cosU2 = Math.cos(u2);

        double lambda = lon;
        double sinSigma;
        double cosSigma;
        double sigma;
        double cosSqAlpha;
        double cos2SigmaM;

        int iteration = 0;
        double previousLambda;
        do {
            double sinLambda = Math.sin(lambda);
            double cosLambda = Math.cos(lambda);
            double crossTerm = cosU1 * sinU2 - sinU1 * cosU2 * cosLambda;
            sinSigma = Math.sqrt((cosU2 * sinLambda) * (cosU2 * sinLambda) + crossTerm * crossTerm);
            if (sinSigma == 0) {
                return 0.0;
            }
            cosSigma = sinU1 * sinU2 + cosU1 * cosU2 * cosLambda;
            sigma = Math.atan2(sinSigma, cosSigma);
            double sinAlpha = cosU1 * cosU2 * sinLambda / sinSigma;
            cosSqAlpha = 1 - sinAlpha * sinAlpha;
            // Equatorial line: cosSqAlpha == 0
            cos2SigmaM = cosSqAlpha != 0 ? cosSigma - 2 * sinU1 * sinU2 / cosSqAlpha : 0;
            double c = FLATTENING / 16 * cosSqAlpha * (4 + FLATTENING * (4 - 3 * cosSqAlpha));
            previousLambda = lambda;
            lambda = lon + (1 - c) * FLATTENING * sinAlpha
                    * (sigma + c * sinSigma * (cos2SigmaM + c * cosSigma * (-1 + 2 * cos2SigmaM * cos2SigmaM)));
        } while (Math.abs(lambda - previousLambda) > CONVERGENCE_THRESHOLD && ++iteration < MAX_ITERATIONS);

        if (iteration >= MAX_ITERATIONS) {
            // Nearly antipodal points do not converge; the sphere is within 0.5% there
            return sphericalMeters(a, b);
        }

        double uSq = cosSqAlpha * (SEMI_MAJOR_AXIS_M * SEMI_MAJOR_AXIS_M - SEMI_MINOR_AXIS_M * SEMI_MINOR_AXIS_M)
                / (SEMI_MINOR_AXIS_M * SEMI_MINOR_AXIS_M);
        double bigA = 1 + uSq / 16384 * (4096 + uSq * (-768 + uSq * (320 - 175 * uSq)));
        double bigB = uSq / 1024 * (256 + uSq * (-128 + uSq * (74 - 47 * uSq)));
        double deltaSigma = bigB * sinSigma * (cos2SigmaM + bigB / 4
                * (cosSigma * (-1 + 2 * cos2SigmaM * cos2SigmaM)
                - bigB / 6 * cos2SigmaM * (-3 + 4 * sinSigma * sinSigma) * (-3 + 4 * cos2SigmaM * cos2SigmaM)));

        return SEMI_MINOR_AXIS_M * bigA * (sigma - deltaSigma);
    }

    /**
     * Haversine distance on the mean-radius sphere.
     */
    static double sphericalMeters(Coordinate a, Coordinate b) {
        double dLat = Math.toRadians(b.latitude() - a.latitude());
        double dLon = Math.toRadians(b.longitude() - a.longitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.latitude())) * Math.cos(Math.toRadians(b.latitude()))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);

        return MEAN_RADIUS_M * 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    /**
     * Arithmetic mean of the given positions. Adequate for the city-scale
     * extents routes cover; not meaningful across the antimeridian.
     */
    public static Coordinate centroid(Iterable<Coordinate> coordinates) {
        double latSum = 0;
        double lonSum = 0;
        int count = 0;
        for (Coordinate coordinate : coordinates) {
            latSum += coordinate.latitude();
            lonSum += coordinate.longitude();
            count++;
        }
        if (count == 0) {
            throw new IllegalArgumentException("Centroid of an empty set");
        }
        return new Coordinate(latSum / count, lonSum / count);
    }

    private static int compare(Coordinate a, Coordinate b) {
        int byLat = Double.compare(a.latitude(), b.latitude());
        return byLat != 0 ? byLat : Double.compare(a.longitude(), b.longitude());
    }
}
