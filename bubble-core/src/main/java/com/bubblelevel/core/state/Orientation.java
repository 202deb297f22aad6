package com.bubblelevel.core.state;

/**
 * Discrete device orientation produced by {@link BubbleStateMachine}.
 *
 * <h3>State definitions</h3>
 * <ul>
 *   <li>{@link #UNKNOWN}        — initial state, or the last averaged coordinates were undefined (NaN)</li>
 *   <li>{@link #FLAT}           — lying on its back, both tilts under the flat threshold</li>
 *   <li>{@link #TILTED_LEFT}    — left edge lowered</li>
 *   <li>{@link #TILTED_RIGHT}   — right edge lowered</li>
 *   <li>{@link #TILTED_FORWARD} — top edge lowered, away from the holder</li>
 *   <li>{@link #TILTED_BACK}    — top edge raised, towards the holder</li>
 *   <li>{@link #VERTICAL}       — standing on an edge, pitch beyond the vertical threshold</li>
 * </ul>
 */
public enum Orientation {
    UNKNOWN,
    FLAT,
    TILTED_LEFT,
    TILTED_RIGHT,
    TILTED_FORWARD,
    TILTED_BACK,
    VERTICAL
}
