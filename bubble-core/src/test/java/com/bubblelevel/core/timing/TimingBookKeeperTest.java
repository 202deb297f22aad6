package com.bubblelevel.core.timing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimingBookKeeperTest {

    @Nested
    @DisplayName("record()")
    class RecordTests {

        @Test
        @DisplayName("stats surface exactly when the window fills")
        void surfacesOnFill() {
            TimingBookKeeper keeper = new TimingBookKeeper(4);
            assertTrue(keeper.record(10).isEmpty());
            assertTrue(keeper.record(20).isEmpty());
            assertTrue(keeper.record(30).isEmpty());

            Optional<JitterStats> stats = keeper.record(40);
            assertTrue(stats.isPresent());
            assertEquals(4, stats.get().count());
            assertEquals(25.0, stats.get().meanMillis(), 1e-9);
            assertEquals(10L, stats.get().minMillis());
            assertEquals(40L, stats.get().maxMillis());
        }

        @Test
        @DisplayName("next window is seeded with the last delta of the previous one")
        void seedsNextWindow() {
            TimingBookKeeper keeper = new TimingBookKeeper(3);
            keeper.record(5);
            keeper.record(6);
            keeper.record(99);
            assertEquals(1, keeper.size());

            keeper.record(1);
            JitterStats next = keeper.record(2).orElseThrow();
            assertEquals(99L, next.maxMillis());
            assertEquals(1L, next.minMillis());
            assertEquals(34.0, next.meanMillis(), 1e-9);
        }

        @Test
        @DisplayName("all-zero deltas never fail")
        void allZeros() {
            TimingBookKeeper keeper = new TimingBookKeeper();
            JitterStats last = null;
            for (int i = 0; i < 5_000; i++) {
                last = keeper.record(0).orElse(last);
            }
            assertNotNull(last);
            assertEquals(0.0, last.meanMillis());
            assertEquals(0.0, last.stdDevMillis());
        }

        @Test
        @DisplayName("single extreme outlier never fails")
        void extremeOutlier() {
            TimingBookKeeper keeper = new TimingBookKeeper(10);
            assertDoesNotThrow(() -> {
                for (int i = 0; i < 30; i++) {
                    keeper.record(i == 7 ? Long.MAX_VALUE : 20);
                }
            });
        }
    }

    @Nested
    @DisplayName("calculate()")
    class CalculateTests {

        @Test
        @DisplayName("population standard deviation")
        void stdDev() {
            JitterStats stats = TimingBookKeeper.calculate(new long[] {2, 4, 4, 4, 5, 5, 7, 9});
            assertEquals(5.0, stats.meanMillis(), 1e-9);
            assertEquals(2.0, stats.stdDevMillis(), 1e-9);
        }

        @Test
        @DisplayName("empty window → zero stats")
        void empty() {
            assertEquals(new JitterStats(0, 0.0, 0.0, 0L, 0L), TimingBookKeeper.calculate(new long[0]));
        }
    }

    @Nested
    @DisplayName("TimingRing")
    class RingTests {

        @Test
        @DisplayName("adding to a full ring without restart → IllegalStateException")
        void fullRing() {
            TimingRing ring = new TimingRing(2);
            ring.add(1);
            ring.add(2);
            assertThrows(IllegalStateException.class, () -> ring.add(3));
        }

        @Test
        @DisplayName("restart keeps only the last element")
        void restart() {
            TimingRing ring = new TimingRing(3);
            ring.add(1);
            ring.add(2);
            ring.add(3);
            ring.restart();
            assertArrayEquals(new long[] {3}, ring.snapshot());
        }

        @Test
        @DisplayName("capacity below 2 → IllegalArgumentException")
        void capacity() {
            assertThrows(IllegalArgumentException.class, () -> new TimingRing(1));
        }
    }
}
