package com.bubblelevel.core.event;

import com.bubblelevel.core.coordinates.Coordinates;
import com.bubblelevel.core.state.Orientation;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Orientation notification emitted once per completed sample window: the
 * classified orientation together with the averaged coordinates it came from.
 */
public record BubbleEvent(
    @JsonProperty("orientation") Orientation orientation,
    @JsonProperty("coordinates") Coordinates coordinates
) {}
