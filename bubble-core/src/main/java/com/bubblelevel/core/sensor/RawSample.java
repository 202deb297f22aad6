package com.bubblelevel.core.sensor;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One timestamped tri-axis reading delivered by a {@link SensorSource}.
 *
 * <p>{@code timestampNanos} is monotonic per channel, mirroring the platform's
 * sensor-event clock. Axis values follow the device frame: x to the right,
 * y towards the top edge, z out of the screen.
 */
public record RawSample(
    @JsonProperty("channel")        SensorChannel channel,
    @JsonProperty("timestampNanos") long          timestampNanos,
    @JsonProperty("x")              float         x,
    @JsonProperty("y")              float         y,
    @JsonProperty("z")              float         z
) {
    public RawSample {
        Objects.requireNonNull(channel, "channel");
    }
}
