package com.bubblelevel.core.coordinates;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attitude of the device, in degrees.
 *
 * <ul>
 *   <li>{@code pitch}: rotation about the x axis; positive when the top edge is raised</li>
 *   <li>{@code roll}: rotation about the y axis; positive when the right edge is lowered</li>
 *   <li>{@code azimuth}: heading of the top edge from magnetic north in [0, 360);
 *       only magnetic-field readings carry one, otherwise NaN</li>
 * </ul>
 *
 * <p>Pitch or roll may be NaN when the source vector was degenerate.
 */
public record Coordinates(
    @JsonProperty("pitch")   double pitch,
    @JsonProperty("roll")    double roll,
    @JsonProperty("azimuth") double azimuth
) {

    /** Tilt only, without a heading. */
    public Coordinates(double pitch, double roll) {
        this(pitch, roll, Double.NaN);
    }

    public boolean isUndefined() {
        return Double.isNaN(pitch) || Double.isNaN(roll);
    }

    public boolean hasAzimuth() {
        return !Double.isNaN(azimuth);
    }
}
