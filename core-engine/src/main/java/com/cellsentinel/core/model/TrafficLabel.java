package com.cellsentinel.core.model;

/**
 * Classification outcome for one signal of one observation.
 *
 * @since 1.0.0
 */
public enum TrafficLabel {

    /** Within {@code mean ± k × σ} of the time-of-week baseline. */
    STABLE,

    /** Above {@code mean + k × σ}. */
    INCREASE,

    /** Below {@code mean − k × σ}. */
    DEGRADATION;

    /**
     * Binary anomaly indicator used by the sustained-anomaly filter. Both
     * non-stable states count equally.
     *
     * @return {@code 0} for {@link #STABLE}, {@code 1} otherwise
     */
    public int indicator() {
        return switch (this) {
            case STABLE -> 0;
            case INCREASE, DEGRADATION -> 1;
        };
    }
}
