package com.bubblelevel.core.sensor;

/**
 * Abstraction over the platform sensor service.
 *
 * <p>Implementations own hardware discovery and delivery timing. The pipeline
 * has no control over inter-arrival gaps and tolerates any of them.
 *
 * <p>Current implementation: {@code RecordedSensorSource} in
 * {@code bubble-replay-service}, which plays back recorded sample files.
 */
public interface SensorSource {

    /**
     * Starts delivering samples of {@code channel} to {@code consumer}.
     *
     * @param channel          the sensor to listen to
     * @param samplingPeriodUs requested sampling period in microseconds; a hint only
     * @param consumer         receiver of samples, invoked on the source's thread
     * @return {@code false} when the hardware for {@code channel} is unavailable
     */
    boolean register(SensorChannel channel, int samplingPeriodUs, SampleConsumer consumer);

    /**
     * Stops delivery to {@code consumer} on every channel it was registered for.
     * Unknown consumers are ignored.
     */
    void unregister(SampleConsumer consumer);
}
