package com.bubblelevel.core.delivery;

import com.bubblelevel.core.event.BubbleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Observable delivery backed by a multicast {@link Sinks.Many}.
 *
 * <p>Events emitted before the first subscriber arrives are buffered, up to
 * {@value #BUFFER_SIZE}; later subscribers only see what is emitted after they
 * subscribe. An event that does not fit the buffer is dropped with a warning.
 * Cancelling every subscriber does not terminate the sink.
 * {@link #close()} completes the stream.
 */
public class StreamDelivery implements BubbleDelivery {

    private static final Logger log = LoggerFactory.getLogger(StreamDelivery.class);

    static final int BUFFER_SIZE = 64;

    private final Sinks.Many<BubbleEvent> sink =
        Sinks.many().multicast().onBackpressureBuffer(BUFFER_SIZE, false);

    public Flux<BubbleEvent> asFlux() {
        return sink.asFlux();
    }

    @Override
    public void deliver(BubbleEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.warn("[Bubble] stream event dropped. orientation={} result={} bufferSize={}",
                     event.orientation(), result, BUFFER_SIZE);
        }
    }

    @Override
    public void close() {
        sink.tryEmitComplete();
    }
}
