package com.bubblelevel.core.pipeline;

import com.bubblelevel.core.aggregation.SampleAggregator;
import com.bubblelevel.core.coordinates.Coordinates;
import com.bubblelevel.core.coordinates.CoordinatesCalculator;
import com.bubblelevel.core.delivery.BubbleDelivery;
import com.bubblelevel.core.event.BubbleEvent;
import com.bubblelevel.core.sensor.RawSample;
import com.bubblelevel.core.sensor.SensorChannel;
import com.bubblelevel.core.state.BubbleStateMachine;
import com.bubblelevel.core.state.Orientation;
import com.bubblelevel.core.timing.JitterStatsSink;
import com.bubblelevel.core.timing.TimingBookKeeper;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Composition root of the orientation core: raw sample → coordinates →
 * sample window → averaged coordinates → orientation → {@link BubbleEvent}.
 *
 * <h3>Per sample</h3>
 * <ol>
 *   <li>The delay since the channel's previous sample goes to that channel's
 *       {@link TimingBookKeeper}; filled windows go to the {@link JitterStatsSink}.</li>
 *   <li>{@link CoordinatesCalculator} turns the sample into coordinates. Tilt
 *       always comes from gravity: an accelerometer sample is used directly and
 *       becomes the latest gravity reading; a magnetic-field sample takes the tilt
 *       of that latest reading and adds its own tilt-compensated azimuth.</li>
 *   <li>The channel's {@link SampleAggregator} buffers them.</li>
 *   <li>When a window completes, the shared {@link BubbleStateMachine} is updated
 *       and an event is delivered, both under one lock.</li>
 * </ol>
 *
 * <h3>Threading</h3>
 * <p>Each channel is expected to deliver from one thread at a time; its stage is
 * private to it. Different channels may deliver concurrently. The state machine
 * update, event construction and delivery are serialised so events reach the
 * delivery in the order the machine produced them.
 *
 * <p>One pipeline serves one registration. After {@link #close()} every call to
 * {@link #accept(RawSample)} fails fast and partially filled windows are dropped.
 */
public class FusionPipeline {

    private final CoordinatesCalculator calculator = new CoordinatesCalculator();
    private final BubbleStateMachine stateMachine = new BubbleStateMachine();
    private final ReentrantLock stateLock = new ReentrantLock();

    private final Map<SensorChannel, ChannelStage> stages;
    private final BubbleDelivery delivery;
    private final JitterStatsSink jitterSink;

    private volatile RawSample latestGravity;
    private volatile boolean closed;

    public FusionPipeline(BubbleSettings settings, BubbleDelivery delivery, JitterStatsSink jitterSink) {
        this.delivery   = delivery;
        this.jitterSink = jitterSink;

        Map<SensorChannel, ChannelStage> byChannel = new EnumMap<>(SensorChannel.class);
        for (SensorChannel channel : SensorChannel.values()) {
            byChannel.put(channel, new ChannelStage(
                new SampleAggregator(settings.sampleSize(), calculator),
                new TimingBookKeeper(settings.jitterWindow())));
        }
        this.stages = Collections.unmodifiableMap(byChannel);
    }

    /**
     * Feeds one sample through the pipeline on the calling thread.
     *
     * @throws IllegalStateException if the pipeline has been closed
     */
    public void accept(RawSample sample) {
        if (closed) {
            throw new IllegalStateException("Pipeline is closed; register the detector again before use.");
        }
        ChannelStage stage = stages.get(sample.channel());

        recordTiming(sample, stage);

        Coordinates coordinates = coordinatesOf(sample);
        Optional<Coordinates> average = stage.aggregator.push(coordinates);
        average.ifPresent(this::publish);
    }

    /** Orientation after the most recent completed window. */
    public Orientation getOrientation() {
        stateLock.lock();
        try {
            return stateMachine.getOrientation();
        } finally {
            stateLock.unlock();
        }
    }

    /** Coordinates buffered in the channel's current, incomplete window. */
    public int pendingSamples(SensorChannel channel) {
        return stages.get(channel).aggregator.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops delivery and releases the delivery target. Partially filled windows
     * are discarded. Idempotent.
     */
    public void close() {
        stateLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            delivery.close();
        } finally {
            stateLock.unlock();
        }
    }

    // ── internals ──────────────────────────────────────────────────────────

    private void recordTiming(RawSample sample, ChannelStage stage) {
        long previous = stage.lastTimestampNanos;
        stage.lastTimestampNanos = sample.timestampNanos();
        if (previous == ChannelStage.NO_SAMPLE) {
            return;
        }
        long deltaMillis = Math.max(0L,
            TimeUnit.NANOSECONDS.toMillis(sample.timestampNanos() - previous));
        stage.bookKeeper.record(deltaMillis)
            .ifPresent(stats -> jitterSink.accept(sample.channel(), stats));
    }

    private Coordinates coordinatesOf(RawSample sample) {
        if (sample.channel() == SensorChannel.ACCELEROMETER) {
            latestGravity = sample;
            return calculator.calculate(sample);
        }
        return calculator.calculate(sample, latestGravity);
    }

    private void publish(Coordinates average) {
        stateLock.lock();
        try {
            if (closed) {
                return;
            }
            Orientation orientation = stateMachine.update(average).getOrientation();
            delivery.deliver(new BubbleEvent(orientation, average));
        } finally {
            stateLock.unlock();
        }
    }

    /** Mutable per-channel state; only touched by the channel's delivery thread. */
    private static final class ChannelStage {

        static final long NO_SAMPLE = Long.MIN_VALUE;

        final SampleAggregator aggregator;
        final TimingBookKeeper bookKeeper;
        long lastTimestampNanos = NO_SAMPLE;

        ChannelStage(SampleAggregator aggregator, TimingBookKeeper bookKeeper) {
            this.aggregator = aggregator;
            this.bookKeeper = bookKeeper;
        }
    }
}
