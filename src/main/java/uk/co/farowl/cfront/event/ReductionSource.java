package uk.co.farowl.cfront.event;

import java.util.Iterator;
import java.util.List;

/**
 * A source of {@link ReductionEvent}s, from which the semantic actions pull one event at a time.
 */
public interface ReductionSource {

    /**
     * Return the next event, or {@code null} at the end of the stream.
     *
     * @return next event or {@code null}
     */
    ReductionEvent nextOrNull();

    /**
     * Return a source that delivers the given events in order.
     *
     * @param events to deliver
     * @return source of those events
     */
    static ReductionSource of(List<ReductionEvent> events) {
        Iterator<ReductionEvent> it = List.copyOf(events).iterator();
        return () -> it.hasNext() ? it.next() : null;
    }
}
