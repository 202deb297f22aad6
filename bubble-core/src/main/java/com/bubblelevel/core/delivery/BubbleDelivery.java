package com.bubblelevel.core.delivery;

import com.bubblelevel.core.event.BubbleEvent;

/**
 * Delivery strategy chosen once when a detector is registered.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link ListenerDelivery} — direct callback to a {@link BubbleListener}</li>
 *   <li>{@link StreamDelivery}   — hot Reactor {@code Flux}</li>
 * </ul>
 *
 * <p>The pipeline serialises calls to {@link #deliver(BubbleEvent)}, so
 * implementations need not be thread-safe on their own.
 */
public interface BubbleDelivery {

    void deliver(BubbleEvent event);

    /**
     * Stops delivery and releases the target. Events delivered afterwards are
     * dropped.
     */
    void close();
}
