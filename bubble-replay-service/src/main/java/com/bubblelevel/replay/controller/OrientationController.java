package com.bubblelevel.replay.controller;

import com.bubblelevel.core.event.BubbleEvent;
import com.bubblelevel.replay.recording.RecordingException;
import com.bubblelevel.replay.service.OrientationStreamService;
import com.bubblelevel.replay.service.ReplayState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * REST + SSE surface of the orientation replay.
 *
 * <p>Typical flow:
 * <ol>
 *   <li>GET  /stream — subscribe to orientation events</li>
 *   <li>POST /start?recording=classpath:recordings/tilt-demo.jsonl — start playback</li>
 *   <li>GET  /status — poll progress</li>
 *   <li>POST /stop — end playback early</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/bubble")
public class OrientationController {

    private static final Logger log = LoggerFactory.getLogger(OrientationController.class);

    private final OrientationStreamService service;
    private final String defaultRecording;

    public OrientationController(OrientationStreamService service,
                                 @Value("${bubble.replay.default-recording:classpath:recordings/tilt-demo.jsonl}")
                                 String defaultRecording) {
        this.service          = service;
        this.defaultRecording = defaultRecording;
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<Map<String, Object>>> start(@RequestParam(required = false) String recording) {
        String location = recording != null && !recording.isBlank() ? recording : defaultRecording;
        log.info("[BubbleAPI] start. recording={}", location);
        return service.start(location)
            .map(s -> ResponseEntity.ok(stateToMap(s)))
            .onErrorResume(RecordingException.class, e -> {
                log.warn("[BubbleAPI] recording unavailable. recording={} missing={}", e.getLocation(), e.isMissing());
                return Mono.just(ResponseEntity.<Map<String, Object>>status(e.isMissing() ? 404 : 400)
                    .body(Map.of("error", String.valueOf(e.getMessage()), "recording", e.getLocation())));
            })
            .onErrorResume(e -> {
                log.error("[BubbleAPI] start error. recording={}", location, e);
                return Mono.just(ResponseEntity.<Map<String, Object>>status(400)
                    .body(Map.of("error", String.valueOf(e.getMessage()))));
            });
    }

    /** Signals playback to stop after the current sample. */
    @PostMapping("/stop")
    public Mono<ResponseEntity<String>> stop() {
        log.info("[BubbleAPI] stop requested");
        return service.stop()
            .then(Mono.just(ResponseEntity.ok("Stop signal sent")));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> status() {
        return Mono.just(ResponseEntity.ok(stateToMap(service.getState())));
    }

    @GetMapping("/orientation")
    public Mono<ResponseEntity<BubbleEvent>> orientation() {
        return service.latestEvent()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<BubbleEvent>> stream() {
        log.info("SSE orientation client connected");
        return service.streamEvents()
            .map(event -> ServerSentEvent.<BubbleEvent>builder()
                .event("orientation")
                .data(event)
                .build());
    }

    private Map<String, Object> stateToMap(ReplayState s) {
        Map<String, Object> m = new HashMap<>();
        m.put("status",          s.getStatus().name());
        m.put("recording",       s.getRecording());
        m.put("samplesReplayed", s.getSamplesReplayed());
        m.put("totalSamples",    s.getTotalSamples());
        m.put("progressPct",     String.format("%.1f", s.getProgressPct()));
        m.put("eventsEmitted",   s.getEventsEmitted());
        m.put("orientation",     service.currentOrientation().name());
        m.put("startedAt",       s.getStartedAt() != null ? s.getStartedAt().toString() : null);
        m.put("errorMessage",    s.getErrorMessage());
        return m;
    }
}
