/**
 * Antenna geometry and facing-cell resolution.
 *
 * <p>
 * {@link com.cellsentinel.core.geo.GeometryEngine} provides bearing, coverage
 * cone and great-circle distance math;
 * {@link com.cellsentinel.core.geo.DirectionalNeighborResolver} uses it to find
 * the cells that face a target cell in a validated
 * {@link com.cellsentinel.core.geo.GeometryTable}.
 * </p>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.geo;
