package com.cellsentinel.core.geo;

/**
 * Spherical-geometry helpers over decimal-degree coordinates and antenna
 * azimuths.
 *
 * <p>
 * All methods are pure functions.
 * </p>
 *
 * @since 1.0.0
 */
public final class GeometryEngine {

    /** Mean Earth radius used for great-circle distances. */
    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Default half beamwidth, i.e. a 120° coverage cone. */
    public static final double DEFAULT_HALF_BEAMWIDTH = 60.0;

    private GeometryEngine() {
        // utility class, not instantiable
    }

    /**
     * Initial compass bearing from point 1 to point 2 along the great circle
     * (forward azimuth).
     *
     * @return bearing in degrees, in {@code [0, 360)}
     */
    public static double bearing(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaLambda = Math.toRadians(lon2 - lon1);

        double y = Math.sin(deltaLambda) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2)
                - Math.sin(phi1) * Math.cos(phi2) * Math.cos(deltaLambda);

        return normalize(Math.toDegrees(Math.atan2(y, x)));
    }

    /**
     * Check whether {@code bearing} lies in the closed cone
     * {@code [azimuth - halfBeamwidth, azimuth + halfBeamwidth]} modulo 360.
     *
     * <p>
     * When the lower bound (mod 360) exceeds the upper bound the cone crosses
     * north, and the accepted set is {@code [lower, 360) ∪ [0, upper]}. A half
     * beamwidth of 180° or more covers the whole circle.
     * </p>
     *
     * @param bearing       direction to test, in degrees
     * @param azimuth       antenna direction, in degrees
     * @param halfBeamwidth half of the cone opening, in degrees; must be &gt;= 0
     * @return {@code true} if the bearing is covered
     * @throws IllegalArgumentException if {@code halfBeamwidth} is negative
     */
    public static boolean withinCoverage(double bearing, double azimuth, double halfBeamwidth) {
        if (halfBeamwidth < 0) {
            throw new IllegalArgumentException("halfBeamwidth must be >= 0, got: " + halfBeamwidth);
        }
        if (halfBeamwidth >= 180) {
            return true;
        }
        double b = normalize(bearing);
        double lower = normalize(azimuth - halfBeamwidth);
        double upper = normalize(azimuth + halfBeamwidth);

        if (lower <= upper) {
            return b >= lower && b <= upper;
        }
        return b >= lower || b <= upper;
    }

    /**
     * {@link #withinCoverage(double, double, double)} with the default 60° half
     * beamwidth.
     */
    public static boolean withinCoverage(double bearing, double azimuth) {
        return withinCoverage(bearing, azimuth, DEFAULT_HALF_BEAMWIDTH);
    }

    /**
     * Great-circle distance between two points (haversine formula).
     *
     * @return distance in kilometres
     */
    public static double greatCircleDistance(double lat1, double lon1, double lat2, double lon2) {
        double latDistance = Math.toRadians(lat2 - lat1);
        double lonDistance = Math.toRadians(lon2 - lon1);

        double a = Math.sin(latDistance / 2) * Math.sin(latDistance / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                        * Math.sin(lonDistance / 2) * Math.sin(lonDistance / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static double normalize(double degrees) {
        double normalized = ((degrees % 360) + 360) % 360;
        // -0.0 and values that round up to 360.0
        return normalized >= 360 || normalized == 0 ? 0.0 : normalized;
    }
}
