package fr.lapetina.hashlb.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating SelectionRequestEvent instances in the Disruptor ring buffer.
 *
 * Events are pre-allocated at startup and reused by clearing and re-initializing them.
 */
public final class SelectionRequestEventFactory implements EventFactory<SelectionRequestEvent> {

    @Override
    public SelectionRequestEvent newInstance() {
        return new SelectionRequestEvent();
    }
}
