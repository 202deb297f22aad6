package com.bubblelevel.core.delivery;

import com.bubblelevel.core.event.BubbleEvent;

/**
 * Push-style receiver of orientation events. Invoked on the sensor delivery
 * thread that completed the window; implementations should return quickly.
 */
@FunctionalInterface
public interface BubbleListener {

    void onOrientationChanged(BubbleEvent event);
}
