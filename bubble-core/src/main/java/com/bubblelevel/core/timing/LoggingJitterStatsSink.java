package com.bubblelevel.core.timing;

import com.bubblelevel.core.sensor.SensorChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each jitter window to the log at INFO, one structured line per window.
 */
public class LoggingJitterStatsSink implements JitterStatsSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingJitterStatsSink.class);

    @Override
    public void accept(SensorChannel channel, JitterStats stats) {
        log.info("[Bubble] stage=JITTER channel={} count={} meanMs={} stdDevMs={} minMs={} maxMs={}",
                 channel, stats.count(),
                 String.format("%.2f", stats.meanMillis()),
                 String.format("%.2f", stats.stdDevMillis()),
                 stats.minMillis(), stats.maxMillis());
    }
}
