package com.bubblelevel.replay.service;

import com.bubblelevel.core.detector.BubbleDetector;
import com.bubblelevel.core.event.BubbleEvent;
import com.bubblelevel.core.sensor.RawSample;
import com.bubblelevel.core.state.Orientation;
import com.bubblelevel.replay.recording.RecordedSensorSource;
import com.bubblelevel.replay.recording.ReplayRecordingReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives recorded sensor playback through the {@link BubbleDetector} and fans
 * the resulting orientation events out to any number of stream subscribers.
 *
 * <p>Lifecycle of one run:
 * <ol>
 *   <li>Load the recording (bounded-elastic, blocking I/O).</li>
 *   <li>Register the detector in observer mode and relay its stream.</li>
 *   <li>Play the samples on a bounded-elastic thread.</li>
 *   <li>Unregister the detector from that same thread once playback ends or is stopped.</li>
 * </ol>
 *
 * <p>Only one run is active at a time.
 */
@Service
public class OrientationStreamService {

    private static final Logger log = LoggerFactory.getLogger(OrientationStreamService.class);

    private final BubbleDetector detector;
    private final RecordedSensorSource source;
    private final ReplayRecordingReader reader;
    private final boolean realtime;

    private final ReplayState state = new ReplayState();
    private final AtomicBoolean stopFlag = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<BubbleEvent> latest = new AtomicReference<>();
    private final Sinks.Many<BubbleEvent> eventSink = Sinks.many().multicast().directBestEffort();

    public OrientationStreamService(BubbleDetector detector,
                                    RecordedSensorSource source,
                                    ReplayRecordingReader reader,
                                    @Value("${bubble.replay.realtime:true}") boolean realtime) {
        this.detector = detector;
        this.source   = source;
        this.reader   = reader;
        this.realtime = realtime;
    }

    // ── Public API ─────────────────────────────────────────────────────────

    /**
     * Starts playing {@code recording} in the background.
     *
     * @param recording Spring resource location of a JSON Lines recording
     * @return the live state, once playback has been launched. Cancelling before
     *         that point abandons the run and leaves the service startable.
     */
    public Mono<ReplayState> start(String recording) {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new IllegalStateException(
                    "Replay already running. recording=" + state.getRecording()));
            }
            stopFlag.set(false);
            // claimed by whichever comes first: the launch or a cancelled caller
            AtomicBoolean settled = new AtomicBoolean(false);

            return Mono.fromCallable(() -> reader.read(recording))
                .subscribeOn(Schedulers.boundedElastic())
                .map(samples -> {
                    if (samples.isEmpty()) {
                        throw new IllegalStateException("Recording has no samples. recording=" + recording);
                    }
                    if (settled.compareAndSet(false, true)) {
                        launch(recording, samples);
                    }
                    return state;
                })
                .doOnError(e -> running.set(false))
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true)) {
                        log.info("[Replay] start cancelled before launch. recording={}", recording);
                        running.set(false);
                    }
                });
        });
    }

    public Mono<Void> stop() {
        log.info("[Replay] stop requested");
        stopFlag.set(true);
        return Mono.empty();
    }

    /** Hot stream of orientation events from every run; never completes. */
    public Flux<BubbleEvent> streamEvents() {
        return eventSink.asFlux();
    }

    /** Most recent event, or empty before the first window of any run completes. */
    public Mono<BubbleEvent> latestEvent() {
        return Mono.justOrEmpty(latest.get());
    }

    public Orientation currentOrientation() {
        BubbleEvent event = latest.get();
        return event != null ? event.orientation() : Orientation.UNKNOWN;
    }

    public ReplayState getState() {
        return state;
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── Internal helpers ───────────────────────────────────────────────────

    private void launch(String recording, List<RawSample> samples) {
        state.start(recording, samples.size());
        detector.register().subscribe(this::relay);
        log.info("[Replay] started. recording={} samples={} realtime={}", recording, samples.size(), realtime);

        Mono.fromRunnable(() -> runLoop(recording, samples))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                v -> {},
                e -> log.error("[Replay] loop failed unexpectedly. recording={}", recording, e)
            );
    }

    private void runLoop(String recording, List<RawSample> samples) {
        String failure = null;
        int delivered = 0;
        try {
            delivered = source.play(samples, realtime, stopFlag::get, state::advance);
        } catch (RuntimeException e) {
            log.error("[Replay] playback failed. recording={}", recording, e);
            failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        } finally {
            detector.unregister();
            if (failure == null) {
                state.complete();
                log.info("[Replay] complete. recording={} delivered={} events={} orientation={}",
                         recording, delivered, state.getEventsEmitted(), currentOrientation());
            } else {
                state.error(failure);
            }
            running.set(false);
        }
    }

    private void relay(BubbleEvent event) {
        latest.set(event);
        state.incrementEvents();
        log.debug("[Replay] event. orientation={} pitch={} roll={}",
                  event.orientation(),
                  String.format("%.1f", event.coordinates().pitch()),
                  String.format("%.1f", event.coordinates().roll()));
        eventSink.tryEmitNext(event);
    }
}
