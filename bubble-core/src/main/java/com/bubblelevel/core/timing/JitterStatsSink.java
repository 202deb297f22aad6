package com.bubblelevel.core.timing;

import com.bubblelevel.core.sensor.SensorChannel;

/**
 * Receiver of jitter diagnostics. Purely informational: nothing a sink does
 * may influence orientation detection.
 *
 * <p>Current implementation: {@link LoggingJitterStatsSink}.
 */
@FunctionalInterface
public interface JitterStatsSink {

    void accept(SensorChannel channel, JitterStats stats);
}
