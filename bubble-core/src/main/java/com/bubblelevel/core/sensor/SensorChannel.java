package com.bubblelevel.core.sensor;

/**
 * Physical sensor input streams consumed by the fusion pipeline.
 *
 * <p>Each channel owns its own aggregation window and timing ring; the only
 * state shared between channels is the orientation state machine.
 */
public enum SensorChannel {

    /** Tri-axis accelerometer, m/s². */
    ACCELEROMETER,

    /** Tri-axis magnetometer, µT. */
    MAGNETIC_FIELD
}
