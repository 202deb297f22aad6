package com.bubblelevel.core.sensor;

/**
 * Callback through which a {@link SensorSource} hands samples of one channel
 * to the pipeline. Invoked on the source's delivery thread.
 */
@FunctionalInterface
public interface SampleConsumer {

    void onSample(RawSample sample);
}
