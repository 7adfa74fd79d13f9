package fr.lapetina.hashlb.domain.event;

import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.LoadBalancerContext;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * It should never be accessed outside the selection pipeline.
 */
public final class SelectionRequestEvent {

    private LoadBalancerContext context;
    private CompletableFuture<Optional<Host>> resultFuture;
    private Instant acceptedAt;
    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.context = null;
        this.resultFuture = null;
        this.acceptedAt = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(LoadBalancerContext context, CompletableFuture<Optional<Host>> resultFuture, long sequence) {
        clear();
        this.context = context;
        this.resultFuture = resultFuture;
        this.acceptedAt = Instant.now();
        this.sequence = sequence;
    }

    public LoadBalancerContext getContext() {
        return context;
    }

    public CompletableFuture<Optional<Host>> getResultFuture() {
        return resultFuture;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "SelectionRequestEvent{sequence=" + sequence + ", context=" + context + '}';
    }
}
