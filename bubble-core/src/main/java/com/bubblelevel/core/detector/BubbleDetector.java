package com.bubblelevel.core.detector;

import com.bubblelevel.core.delivery.BubbleDelivery;
import com.bubblelevel.core.delivery.BubbleListener;
import com.bubblelevel.core.delivery.ListenerDelivery;
import com.bubblelevel.core.delivery.StreamDelivery;
import com.bubblelevel.core.event.BubbleEvent;
import com.bubblelevel.core.pipeline.BubbleSettings;
import com.bubblelevel.core.pipeline.FusionPipeline;
import com.bubblelevel.core.sensor.SampleConsumer;
import com.bubblelevel.core.sensor.SensorChannel;
import com.bubblelevel.core.sensor.SensorSource;
import com.bubblelevel.core.state.Orientation;
import com.bubblelevel.core.timing.JitterStatsSink;
import com.bubblelevel.core.timing.LoggingJitterStatsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Lifecycle controller that wires a {@link SensorSource} to a fresh
 * {@link FusionPipeline} on every registration.
 *
 * <p>Typical use:
 * <pre>
 *     BubbleDetector detector = new BubbleDetector(sensorSource);
 *     Flux&lt;BubbleEvent&gt; events = detector.register();
 *     ...
 *     detector.unregister();
 * </pre>
 *
 * <p>The delivery shape (callback or stream) is fixed per registration. A new
 * registration always starts from empty sample windows and an
 * {@link Orientation#UNKNOWN} orientation.
 */
public class BubbleDetector {

    private static final Logger log = LoggerFactory.getLogger(BubbleDetector.class);

    public enum Registration { UNREGISTERED, LISTENER, OBSERVER }

    private final SensorSource sensorSource;
    private final BubbleSettings settings;
    private final JitterStatsSink jitterSink;

    private Registration registration = Registration.UNREGISTERED;
    private FusionPipeline pipeline;
    private SampleConsumer sampleConsumer;

    public BubbleDetector(SensorSource sensorSource) {
        this(sensorSource, BubbleSettings.defaults(), new LoggingJitterStatsSink());
    }

    public BubbleDetector(SensorSource sensorSource, BubbleSettings settings, JitterStatsSink jitterSink) {
        this.sensorSource = sensorSource;
        this.settings     = settings;
        this.jitterSink   = jitterSink;
    }

    /**
     * Registers in observer mode.
     *
     * @return hot stream of orientation events; completes on {@link #unregister()}
     * @throws IllegalStateException if already registered
     */
    public synchronized Flux<BubbleEvent> register() {
        StreamDelivery delivery = new StreamDelivery();
        start(Registration.OBSERVER, delivery);
        return delivery.asFlux();
    }

    /**
     * Registers in listener mode.
     *
     * @throws IllegalStateException if already registered
     */
    public synchronized void register(BubbleListener listener) {
        start(Registration.LISTENER, new ListenerDelivery(listener));
    }

    /**
     * Stops sensor delivery, completes or releases the delivery target and drops
     * any partially filled window.
     *
     * @throws IllegalStateException if not registered
     */
    public synchronized void unregister() {
        ifRegistered();
        sensorSource.unregister(sampleConsumer);
        pipeline.close();
        log.info("[Bubble] stage=UNREGISTERED mode={}", registration);

        registration   = Registration.UNREGISTERED;
        pipeline       = null;
        sampleConsumer = null;
    }

    public synchronized Registration getRegistration() {
        return registration;
    }

    /**
     * Orientation of the active registration.
     *
     * @throws IllegalStateException if not registered
     */
    public synchronized Orientation getOrientation() {
        ifRegistered();
        return pipeline.getOrientation();
    }

    // ── internals ──────────────────────────────────────────────────────────

    private void start(Registration mode, BubbleDelivery delivery) {
        if (registration != Registration.UNREGISTERED) {
            throw new IllegalStateException("Detector is already registered. mode=" + registration);
        }
        FusionPipeline fresh = new FusionPipeline(settings, delivery, jitterSink);
        SampleConsumer consumer = fresh::accept;

        pipeline       = fresh;
        sampleConsumer = consumer;
        registration   = mode;

        for (SensorChannel channel : SensorChannel.values()) {
            boolean registered = sensorSource.register(channel, settings.samplingPeriodUs(), consumer);
            if (!registered) {
                log.warn("[Bubble] sensor unavailable. channel={}", channel);
            }
        }
        log.info("[Bubble] stage=REGISTERED mode={} sampleSize={} samplingPeriodUs={}",
                 mode, settings.sampleSize(), settings.samplingPeriodUs());
    }

    private void ifRegistered() {
        if (registration == Registration.UNREGISTERED) {
            throw new IllegalStateException("Detector must be registered before use.");
        }
    }
}
