package com.bubblelevel.replay.recording;

import com.bubblelevel.core.sensor.RawSample;
import com.bubblelevel.core.sensor.SampleConsumer;
import com.bubblelevel.core.sensor.SensorChannel;
import com.bubblelevel.core.sensor.SensorSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/**
 * {@link SensorSource} that plays back recorded samples instead of reading hardware.
 *
 * <p>Every channel is always available. Playback and (un)registration are
 * mutually exclusive: once {@link #unregister(SampleConsumer)} returns, no
 * sample is in flight towards that consumer.
 */
public class RecordedSensorSource implements SensorSource {

    private static final Logger log = LoggerFactory.getLogger(RecordedSensorSource.class);

    /** Longest pause honoured between two samples in realtime mode. */
    private static final long MAX_GAP_MS = 1_000;

    private final Map<SensorChannel, SampleConsumer> consumers = new EnumMap<>(SensorChannel.class);

    @Override
    public synchronized boolean register(SensorChannel channel, int samplingPeriodUs, SampleConsumer consumer) {
        consumers.put(channel, consumer);
        log.debug("[Recorded] channel registered. channel={} samplingPeriodUs={}", channel, samplingPeriodUs);
        return true;
    }

    @Override
    public synchronized void unregister(SampleConsumer consumer) {
        consumers.values().removeIf(c -> c == consumer);
    }

    /**
     * Delivers {@code samples} in order on the calling thread.
     *
     * <p>Blocking: in realtime mode the thread sleeps for the recorded gap
     * between consecutive samples. Run on a bounded-elastic worker.
     *
     * @param samples  recording, ordered by timestamp
     * @param realtime whether to honour recorded inter-sample gaps
     * @param stop     polled before each sample; playback ends when it returns true
     * @param progress receives the index of each delivered sample
     * @return number of samples delivered
     */
    public int play(List<RawSample> samples, boolean realtime, BooleanSupplier stop, IntConsumer progress) {
        long previousNanos = Long.MIN_VALUE;
        int delivered = 0;

        for (int i = 0; i < samples.size(); i++) {
            if (stop.getAsBoolean()) {
                log.info("[Recorded] stop requested at sample {}/{}", i, samples.size());
                break;
            }
            RawSample sample = samples.get(i);

            if (realtime && previousNanos != Long.MIN_VALUE) {
                long gapMs = Math.min(MAX_GAP_MS,
                    TimeUnit.NANOSECONDS.toMillis(sample.timestampNanos() - previousNanos));
                if (gapMs > 0 && !pause(gapMs)) {
                    break;
                }
            }
            previousNanos = sample.timestampNanos();

            if (deliver(sample)) {
                delivered++;
            }
            progress.accept(i + 1);
        }
        return delivered;
    }

    private synchronized boolean deliver(RawSample sample) {
        SampleConsumer consumer = consumers.get(sample.channel());
        if (consumer == null) {
            return false;
        }
        consumer.onSample(sample);
        return true;
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Recorded] interrupted during pause; stopping playback");
            return false;
        }
    }
}
