package com.bubblelevel.core.coordinates;

import com.bubblelevel.core.sensor.RawSample;

import java.util.List;

/**
 * Pure stateless geometry that turns raw sensor vectors into {@link Coordinates}
 * and reduces a full sample window to its mean.
 *
 * <p>Tilt always comes from a gravity (accelerometer) vector:
 * <pre>
 * pitch = atan2(y, sqrt(x² + z²))
 * roll  = atan2(-x, z)
 * </pre>
 * A magnetic-field vector only contributes the azimuth, tilt-compensated with
 * the gravity vector taken at the same moment.
 *
 * <p>Never throws for any sample. NaN axes propagate into NaN ordinates and
 * infinite axes yield finite or NaN angles; classification absorbs both.
 * No logging. No side-effects.
 */
public final class CoordinatesCalculator {

    /** Below this the horizontal field is too weak for a heading (free fall, magnetic pole). */
    private static final double MIN_HORIZONTAL_FIELD = 0.1;

    /** Tilt from a gravity sample. The result carries no azimuth. */
    public Coordinates calculate(RawSample gravity) {
        double x = gravity.x();
        double y = gravity.y();
        double z = gravity.z();

        double pitch = Math.toDegrees(Math.atan2(y, Math.sqrt(x * x + z * z)));
        double roll  = Math.toDegrees(Math.atan2(-x, z));
        return new Coordinates(pitch, roll);
    }

    /**
     * Tilt from {@code gravity} plus the tilt-compensated azimuth of
     * {@code geomagnetic}.
     *
     * @param gravity latest accelerometer sample, or {@code null} before the
     *                first one arrived; then every ordinate is NaN
     */
    public Coordinates calculate(RawSample geomagnetic, RawSample gravity) {
        if (gravity == null) {
            return new Coordinates(Double.NaN, Double.NaN, Double.NaN);
        }
        Coordinates tilt = calculate(gravity);
        return new Coordinates(tilt.pitch(), tilt.roll(), azimuth(geomagnetic, gravity));
    }

    /**
     * Arithmetic mean of pitch and roll across the window. Azimuths are
     * averaged on the circle so 359 and 1 give 0, not 180.
     *
     * @param coordinates non-empty window, in arrival order
     * @throws IllegalArgumentException if {@code coordinates} is empty
     */
    public Coordinates calculateAverage(List<Coordinates> coordinates) {
        if (coordinates.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty coordinates window");
        }

        double pitchSum = 0.0;
        double rollSum  = 0.0;
        double sinSum   = 0.0;
        double cosSum   = 0.0;
        for (Coordinates c : coordinates) {
            pitchSum += c.pitch();
            rollSum  += c.roll();
            double rad = Math.toRadians(c.azimuth());
            sinSum += Math.sin(rad);
            cosSum += Math.cos(rad);
        }
        int n = coordinates.size();
        return new Coordinates(pitchSum / n, rollSum / n, normalize(Math.toDegrees(Math.atan2(sinSum, cosSum))));
    }

    // ── internals ──────────────────────────────────────────────────────────

    // East = E x A, north = A x east; azimuth is the angle of the device y axis from north.
    private static double azimuth(RawSample e, RawSample a) {
        double ax = a.x();
        double ay = a.y();
        double az = a.z();
        double normA = Math.sqrt(ax * ax + ay * ay + az * az);

        double hx = e.y() * az - e.z() * ay;
        double hy = e.z() * ax - e.x() * az;
        double hz = e.x() * ay - e.y() * ax;
        double normH = Math.sqrt(hx * hx + hy * hy + hz * hz);
        if (!(normH >= MIN_HORIZONTAL_FIELD) || !(normA > 0.0)) {
            return Double.NaN;
        }
        hx /= normH;
        hz /= normH;
        ax /= normA;
        az /= normA;

        double my = az * hx - ax * hz;
        return normalize(Math.toDegrees(Math.atan2(hy / normH, my)));
    }

    private static double normalize(double degrees) {
        double d = degrees % 360.0;
        return d < 0.0 ? d + 360.0 : d;
    }
}
