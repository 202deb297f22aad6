package com.bubblelevel.core.state;

import com.bubblelevel.core.coordinates.Coordinates;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link BubbleStateMachine}.
 * Covers every orientation region and the documented boundary sides.
 */
class BubbleStateMachineTest {

    private static Coordinates at(double pitch, double roll) {
        return new Coordinates(pitch, roll);
    }

    @Nested
    @DisplayName("classify() → regions")
    class RegionTests {

        @Test
        @DisplayName("small tilts → FLAT")
        void flat() {
            assertEquals(Orientation.FLAT, BubbleStateMachine.classify(at(3.0, -4.0)));
        }

        @Test
        @DisplayName("pitch near +90 → VERTICAL")
        void verticalPortrait() {
            assertEquals(Orientation.VERTICAL, BubbleStateMachine.classify(at(85.0, 2.0)));
        }

        @Test
        @DisplayName("pitch near -90 → VERTICAL")
        void verticalUpsideDown() {
            assertEquals(Orientation.VERTICAL, BubbleStateMachine.classify(at(-75.0, 0.0)));
        }

        @Test
        @DisplayName("positive roll dominating → TILTED_RIGHT")
        void right() {
            assertEquals(Orientation.TILTED_RIGHT, BubbleStateMachine.classify(at(10.0, 40.0)));
        }

        @Test
        @DisplayName("negative roll dominating → TILTED_LEFT")
        void left() {
            assertEquals(Orientation.TILTED_LEFT, BubbleStateMachine.classify(at(-5.0, -30.0)));
        }

        @Test
        @DisplayName("positive pitch dominating → TILTED_BACK")
        void back() {
            assertEquals(Orientation.TILTED_BACK, BubbleStateMachine.classify(at(35.0, 5.0)));
        }

        @Test
        @DisplayName("negative pitch dominating → TILTED_FORWARD")
        void forward() {
            assertEquals(Orientation.TILTED_FORWARD, BubbleStateMachine.classify(at(-40.0, -20.0)));
        }

        @Test
        @DisplayName("NaN ordinate → UNKNOWN, no exception")
        void nan() {
            assertEquals(Orientation.UNKNOWN, BubbleStateMachine.classify(at(Double.NaN, 0.0)));
            assertEquals(Orientation.UNKNOWN, BubbleStateMachine.classify(at(0.0, Double.NaN)));
        }

        @Test
        @DisplayName("roll beyond vertical threshold but pitch low → tilted sideways, not VERTICAL")
        void landscapeRoll() {
            assertEquals(Orientation.TILTED_RIGHT, BubbleStateMachine.classify(at(0.0, 90.0)));
        }
    }

    @Nested
    @DisplayName("classify() → boundaries")
    class BoundaryTests {

        @Test
        @DisplayName("|pitch| exactly at vertical threshold → VERTICAL")
        void verticalBoundary() {
            assertEquals(Orientation.VERTICAL,
                BubbleStateMachine.classify(at(BubbleStateMachine.VERTICAL_THRESHOLD, 0.0)));
            assertEquals(Orientation.VERTICAL,
                BubbleStateMachine.classify(at(-BubbleStateMachine.VERTICAL_THRESHOLD, 0.0)));
        }

        @Test
        @DisplayName("roll exactly at flat threshold → tilted, not FLAT")
        void flatBoundaryRoll() {
            assertEquals(Orientation.TILTED_RIGHT,
                BubbleStateMachine.classify(at(0.0, BubbleStateMachine.FLAT_THRESHOLD)));
        }

        @Test
        @DisplayName("pitch exactly at flat threshold → tilted, not FLAT")
        void flatBoundaryPitch() {
            assertEquals(Orientation.TILTED_FORWARD,
                BubbleStateMachine.classify(at(-BubbleStateMachine.FLAT_THRESHOLD, 0.0)));
        }

        @Test
        @DisplayName("equal roll and pitch magnitudes → roll axis wins")
        void diagonalTie() {
            assertEquals(Orientation.TILTED_LEFT, BubbleStateMachine.classify(at(30.0, -30.0)));
        }

        @Test
        @DisplayName("boundary resolution is stable across repeated runs")
        void repeatable() {
            Coordinates boundary = at(BubbleStateMachine.FLAT_THRESHOLD, BubbleStateMachine.FLAT_THRESHOLD);
            Orientation first = BubbleStateMachine.classify(boundary);
            for (int i = 0; i < 100; i++) {
                assertEquals(first, BubbleStateMachine.classify(boundary), "iteration " + i);
            }
        }
    }

    @Nested
    @DisplayName("update()")
    class UpdateTests {

        @Test
        @DisplayName("starts in UNKNOWN")
        void initialState() {
            assertEquals(Orientation.UNKNOWN, new BubbleStateMachine().getOrientation());
        }

        @Test
        @DisplayName("same coordinates from the same state → same result both times")
        void deterministic() {
            Coordinates c = at(20.0, -50.0);
            BubbleStateMachine a = new BubbleStateMachine();
            BubbleStateMachine b = new BubbleStateMachine();

            assertEquals(a.update(c).getOrientation(), b.update(c).getOrientation());
            assertEquals(Orientation.TILTED_LEFT, a.update(c).getOrientation());
        }

        @Test
        @DisplayName("any state may follow any other in one update")
        void freeTransitions() {
            BubbleStateMachine machine = new BubbleStateMachine();
            assertEquals(Orientation.VERTICAL, machine.update(at(80.0, 0.0)).getOrientation());
            assertEquals(Orientation.UNKNOWN, machine.update(at(Double.NaN, 0.0)).getOrientation());
            assertEquals(Orientation.FLAT, machine.update(at(0.0, 0.0)).getOrientation());
        }
    }
}
