package com.bubblelevel.core.delivery;

import com.bubblelevel.core.event.BubbleEvent;

import java.util.Objects;

/**
 * Callback delivery. The listener reference is dropped on {@link #close()}.
 */
public class ListenerDelivery implements BubbleDelivery {

    private volatile BubbleListener listener;

    public ListenerDelivery(BubbleListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void deliver(BubbleEvent event) {
        BubbleListener target = listener;
        if (target != null) {
            target.onOrientationChanged(event);
        }
    }

    @Override
    public void close() {
        listener = null;
    }
}
