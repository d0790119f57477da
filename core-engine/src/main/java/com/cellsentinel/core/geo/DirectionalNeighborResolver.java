package com.cellsentinel.core.geo;

import com.cellsentinel.core.model.CellGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the cells that physically face a target cell.
 *
 * <p>
 * A candidate is a neighbour of the target when either:
 * </p>
 * <ul>
 * <li><b>mutual facing</b>: it is on a different site, within the target's
 * {@code maxDistanceKm}, the target's cone covers the bearing
 * target → candidate <em>and</em> the candidate's cone covers the bearing
 * candidate → target; or</li>
 * <li><b>co-location</b>: it shares the target's site and azimuth (one sector
 * split across hardware), where the distance/bearing test is meaningless.</li>
 * </ul>
 *
 * <h3>Complexity</h3>
 * <p>
 * Each call scans the whole geometry table: O(cells) per target and
 * O(targets × cells) per batch. No spatial index is used.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class DirectionalNeighborResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DirectionalNeighborResolver.class);

    private final double halfBeamwidth;

    public DirectionalNeighborResolver() {
        this(GeometryEngine.DEFAULT_HALF_BEAMWIDTH);
    }

    /**
     * @param halfBeamwidth half opening of every antenna's coverage cone, in
     *                      degrees
     * @throws IllegalArgumentException if {@code halfBeamwidth} is not in
     *                                  {@code (0, 180]}
     */
    public DirectionalNeighborResolver(double halfBeamwidth) {
        if (!(halfBeamwidth > 0 && halfBeamwidth <= 180)) {
            throw new IllegalArgumentException(
                    "halfBeamwidth must be in (0, 180], got: " + halfBeamwidth);
        }
        this.halfBeamwidth = halfBeamwidth;
    }

    /**
     * Facing cells of {@code targetCell}, with an unknown target reported as an
     * empty set.
     *
     * @param geometry   validated geometry table
     * @param targetCell cell id to resolve
     * @return unmodifiable set of neighbour rows; empty if the target has no
     *         neighbour or is absent from the table
     * @see #findFacingCells(GeometryTable, String)
     */
    public Set<CellGeometry> facingCells(GeometryTable geometry, String targetCell) {
        return findFacingCells(geometry, targetCell).orElse(Collections.emptySet());
    }

    /**
     * Facing cells of {@code targetCell}, distinguishing an unknown target from
     * one without neighbours.
     *
     * @param geometry   validated geometry table; must not be {@code null}
     * @param targetCell cell id to resolve; must not be {@code null}
     * @return empty if the target is not in the table, otherwise an unmodifiable
     *         (possibly empty) set of neighbour rows in table order
     */
    public Optional<Set<CellGeometry>> findFacingCells(GeometryTable geometry, String targetCell) {
        Objects.requireNonNull(geometry, "Geometry table must not be null");
        Objects.requireNonNull(targetCell, "Target cell must not be null");

        Optional<CellGeometry> found = geometry.find(targetCell);
        if (found.isEmpty()) {
            LOG.debug("Cell [{}] not present in geometry table", targetCell);
            return Optional.empty();
        }
        CellGeometry target = found.get();

        Set<CellGeometry> neighbors = new LinkedHashSet<>();
        for (CellGeometry candidate : geometry.rows()) {
            if (candidate.getCellId().equals(target.getCellId())) {
                continue;
            }
            if (isCoLocated(target, candidate) || isMutuallyFacing(target, candidate)) {
                neighbors.add(candidate);
            }
        }

        LOG.debug("Cell [{}] faces {} cell(s)", targetCell, neighbors.size());
        return Optional.of(Collections.unmodifiableSet(neighbors));
    }

    public double getHalfBeamwidth() {
        return halfBeamwidth;
    }

    // ---------------------------------------------------------------
    // Facing tests
    // ---------------------------------------------------------------

    /**
     * Same site and same azimuth.
     */
    static boolean isCoLocated(CellGeometry target, CellGeometry candidate) {
        return target.isSameSite(candidate)
                && Double.compare(target.getAzimuth(), candidate.getAzimuth()) == 0;
    }

    /**
     * Different site, within the target's range, and each antenna covers the
     * other.
     */
    boolean isMutuallyFacing(CellGeometry target, CellGeometry candidate) {
        if (target.isSameSite(candidate)) {
            return false;
        }

        double distance = GeometryEngine.greatCircleDistance(
                target.getLatitude(), target.getLongitude(),
                candidate.getLatitude(), candidate.getLongitude());
        if (distance > target.getMaxDistanceKm()) {
            return false;
        }

        double outbound = GeometryEngine.bearing(
                target.getLatitude(), target.getLongitude(),
                candidate.getLatitude(), candidate.getLongitude());
        if (!GeometryEngine.withinCoverage(outbound, target.getAzimuth(), halfBeamwidth)) {
            return false;
        }

        // Not simply outbound + 180 on longer hops
        double inbound = GeometryEngine.bearing(
                candidate.getLatitude(), candidate.getLongitude(),
                target.getLatitude(), target.getLongitude());
        return GeometryEngine.withinCoverage(inbound, candidate.getAzimuth(), halfBeamwidth);
    }
}
