package com.bubblelevel.replay.recording;

import com.bubblelevel.core.sensor.RawSample;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads sensor recordings stored as JSON Lines, one {@link RawSample} per line:
 * <pre>
 * {"channel":"ACCELEROMETER","timestampNanos":20000000,"x":0.1,"y":0.2,"z":9.8}
 * </pre>
 *
 * <p>Blank lines and lines starting with {@code #} are ignored. Malformed lines
 * are logged and skipped. Samples are returned sorted by timestamp.
 */
@Component
public class ReplayRecordingReader {

    private static final Logger log = LoggerFactory.getLogger(ReplayRecordingReader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public ReplayRecordingReader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
    }

    /**
     * @param location Spring resource location, e.g. {@code classpath:recordings/tilt-demo.jsonl}
     * @throws RecordingException if the resource is missing or unreadable
     */
    public List<RawSample> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw RecordingException.notFound(location);
        }

        List<RawSample> samples = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                try {
                    samples.add(objectMapper.readValue(trimmed, RawSample.class));
                } catch (JsonProcessingException e) {
                    skipped++;
                    log.warn("[Recording] malformed line skipped. location={} line={} err={}",
                             location, lineNo, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw RecordingException.unreadable(location, e);
        }

        samples.sort(Comparator.comparingLong(RawSample::timestampNanos));
        log.info("[Recording] loaded. location={} samples={} skipped={}", location, samples.size(), skipped);
        return samples;
    }
}
