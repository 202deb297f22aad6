package com.bubblelevel.replay.service;

import com.bubblelevel.core.detector.BubbleDetector;
import com.bubblelevel.core.event.BubbleEvent;
import com.bubblelevel.core.pipeline.BubbleSettings;
import com.bubblelevel.core.sensor.RawSample;
import com.bubblelevel.core.state.Orientation;
import com.bubblelevel.core.timing.LoggingJitterStatsSink;
import com.bubblelevel.replay.recording.RecordedSensorSource;
import com.bubblelevel.replay.recording.ReplayRecordingReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrientationStreamServiceTest {

    private static final String RECORDING = "classpath:recordings/flat-then-upright.jsonl";

    private OrientationStreamService service(boolean realtime) {
        return service(new ReplayRecordingReader(new DefaultResourceLoader(), new ObjectMapper()), realtime);
    }

    private OrientationStreamService service(ReplayRecordingReader reader, boolean realtime) {
        RecordedSensorSource source = new RecordedSensorSource();
        BubbleDetector detector = new BubbleDetector(source, BubbleSettings.defaults(), new LoggingJitterStatsSink());
        return new OrientationStreamService(detector, source, reader, realtime);
    }

    /** Holds every read until {@link #loading} is counted down. */
    private static final class GatedReader extends ReplayRecordingReader {

        final CountDownLatch loading = new CountDownLatch(1);

        GatedReader() {
            super(new DefaultResourceLoader(), new ObjectMapper());
        }

        @Override
        public List<RawSample> read(String location) {
            try {
                loading.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return super.read(location);
        }
    }

    private static void awaitFinished(OrientationStreamService service) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (service.isRunning()) {
            if (System.nanoTime() > deadline) {
                fail("replay did not finish in time");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("replay emits one event per accelerometer window, in order")
    void replayEmitsEvents() throws InterruptedException {
        OrientationStreamService service = service(false);
        List<BubbleEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = service.streamEvents().subscribe(received::add);

        ReplayState state = service.start(RECORDING).block(Duration.ofSeconds(5));
        assertNotNull(state);
        awaitFinished(service);
        subscription.dispose();

        assertEquals(ReplayState.Status.COMPLETE, service.getState().getStatus());
        assertEquals(65, service.getState().getSamplesReplayed());
        assertEquals(3, service.getState().getEventsEmitted());
        assertEquals(List.of(Orientation.FLAT, Orientation.FLAT, Orientation.VERTICAL),
                     received.stream().map(BubbleEvent::orientation).toList());
        assertEquals(Orientation.VERTICAL, service.currentOrientation());
    }

    @Test
    @DisplayName("a finished replay can be started again")
    void restartable() throws InterruptedException {
        OrientationStreamService service = service(false);
        service.start(RECORDING).block(Duration.ofSeconds(5));
        awaitFinished(service);

        service.start(RECORDING).block(Duration.ofSeconds(5));
        awaitFinished(service);
        assertEquals(ReplayState.Status.COMPLETE, service.getState().getStatus());
        assertEquals(3, service.getState().getEventsEmitted());
    }

    @Test
    @DisplayName("starting while running → error; stop ends the run")
    void singleRunAtATime() throws InterruptedException {
        OrientationStreamService service = service(true);
        service.start(RECORDING).block(Duration.ofSeconds(5));

        assertThrows(IllegalStateException.class, () -> service.start(RECORDING).block(Duration.ofSeconds(5)));

        service.stop().block();
        awaitFinished(service);
        assertTrue(service.getState().getSamplesReplayed() < 65);
    }

    @Test
    @DisplayName("start cancelled while loading → service stays startable")
    void cancelledWhileLoading() throws InterruptedException {
        GatedReader reader = new GatedReader();
        OrientationStreamService service = service(reader, false);

        service.start(RECORDING).subscribe().dispose();
        assertFalse(service.isRunning());
        assertEquals(ReplayState.Status.IDLE, service.getState().getStatus());

        reader.loading.countDown();
        ReplayState state = service.start(RECORDING).block(Duration.ofSeconds(5));
        assertNotNull(state);
        awaitFinished(service);
        assertEquals(ReplayState.Status.COMPLETE, service.getState().getStatus());
        assertEquals(3, service.getState().getEventsEmitted());
    }

    @Test
    @DisplayName("missing recording → error, service stays startable")
    void missingRecording() throws InterruptedException {
        OrientationStreamService service = service(false);
        assertThrows(RuntimeException.class,
            () -> service.start("classpath:recordings/missing.jsonl").block(Duration.ofSeconds(5)));

        service.start(RECORDING).block(Duration.ofSeconds(5));
        awaitFinished(service);
        assertEquals(ReplayState.Status.COMPLETE, service.getState().getStatus());
    }
}
