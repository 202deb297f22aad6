package com.bubblelevel.replay.config;

import com.bubblelevel.core.detector.BubbleDetector;
import com.bubblelevel.core.pipeline.BubbleSettings;
import com.bubblelevel.core.timing.JitterStatsSink;
import com.bubblelevel.core.timing.LoggingJitterStatsSink;
import com.bubblelevel.replay.recording.RecordedSensorSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BubbleConfig {

    @Value("${bubble.sample-size:20}")
    private int sampleSize;

    @Value("${bubble.sampling-period-us:20000}")
    private int samplingPeriodUs;

    @Value("${bubble.jitter-window:1000}")
    private int jitterWindow;

    @Bean
    public BubbleSettings bubbleSettings() {
        return new BubbleSettings(sampleSize, samplingPeriodUs, jitterWindow);
    }

    @Bean
    public JitterStatsSink jitterStatsSink() {
        return new LoggingJitterStatsSink();
    }

    @Bean
    public RecordedSensorSource recordedSensorSource() {
        return new RecordedSensorSource();
    }

    @Bean
    public BubbleDetector bubbleDetector(RecordedSensorSource source,
                                         BubbleSettings settings,
                                         JitterStatsSink jitterStatsSink) {
        return new BubbleDetector(source, settings, jitterStatsSink);
    }
}
