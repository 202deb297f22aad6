package com.bubblelevel.core.state;

import com.bubblelevel.core.coordinates.Coordinates;

/**
 * Caches the orientation classified from the latest averaged coordinates.
 *
 * <p>Classification itself is stateless ({@link #classify(Coordinates)}); the
 * machine only remembers the current orientation between updates. There are no
 * forbidden transitions and no terminal state, and an update with unchanged
 * coordinates is not suppressed.
 *
 * <h3>Decision procedure</h3>
 * <p>Evaluated top-to-bottom, first match wins (degrees):
 * <pre>
 * UNKNOWN:              pitch or roll is NaN
 * VERTICAL:             |pitch| &gt;= 60
 * FLAT:                 |pitch| &lt; 15 and |roll| &lt; 15
 * TILTED_RIGHT / LEFT:  |roll| &gt;= |pitch|, by sign of roll (roll &gt; 0 is right)
 * TILTED_BACK / FORWARD: otherwise, by sign of pitch (pitch &gt; 0 is back)
 * </pre>
 * A value exactly on a threshold resolves to the more tilted region; equal
 * magnitudes of roll and pitch resolve to the roll axis.
 *
 * <p>Not thread-safe. Callers sharing one machine across channels serialise
 * {@link #update(Coordinates)} themselves.
 */
public class BubbleStateMachine {

    /** |pitch| at or above which the device is considered standing on an edge. */
    static final double VERTICAL_THRESHOLD = 60.0;

    /** Both tilts strictly below this are considered flat. */
    static final double FLAT_THRESHOLD = 15.0;

    private Orientation orientation = Orientation.UNKNOWN;

    public BubbleStateMachine update(Coordinates coordinates) {
        orientation = classify(coordinates);
        return this;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public static Orientation classify(Coordinates coordinates) {
        if (coordinates.isUndefined()) {
            return Orientation.UNKNOWN;
        }

        double absPitch = Math.abs(coordinates.pitch());
        double absRoll  = Math.abs(coordinates.roll());

        if (absPitch >= VERTICAL_THRESHOLD) {
            return Orientation.VERTICAL;
        }
        if (absPitch < FLAT_THRESHOLD && absRoll < FLAT_THRESHOLD) {
            return Orientation.FLAT;
        }
        if (absRoll >= absPitch) {
            return coordinates.roll() > 0 ? Orientation.TILTED_RIGHT : Orientation.TILTED_LEFT;
        }
        return coordinates.pitch() > 0 ? Orientation.TILTED_BACK : Orientation.TILTED_FORWARD;
    }
}
