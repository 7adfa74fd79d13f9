package fr.lapetina.hashlb.disruptor.handlers;

import com.lmax.disruptor.WorkHandler;
import fr.lapetina.hashlb.domain.balancer.ThreadAwareLoadBalancer;
import fr.lapetina.hashlb.domain.balancer.WorkerSelector;
import fr.lapetina.hashlb.domain.event.SelectionRequestEvent;
import fr.lapetina.hashlb.domain.model.Host;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker of the selection pool. Each instance is driven by exactly one thread and owns
 * exactly one {@link WorkerSelector}, replaced when the load balancer epoch moves on.
 */
public final class WorkerSelectionHandler implements WorkHandler<SelectionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(WorkerSelectionHandler.class);

    private final ThreadAwareLoadBalancer loadBalancer;
    private final int workerId;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong selectorRefreshes = new AtomicLong();

    private WorkerSelector selector;

    public WorkerSelectionHandler(ThreadAwareLoadBalancer loadBalancer, int workerId) {
        this.loadBalancer = loadBalancer;
        this.workerId = workerId;
    }

    @Override
    public void onEvent(SelectionRequestEvent event) {
        WorkerSelector current = currentSelector();
        Optional<Host> host = current.chooseHost(event.getContext());

        if (log.isDebugEnabled()) {
            log.debug("Worker {} selected {} for sequence={} generation={}",
                    workerId, host.map(Host::getAddress).orElse("<none>"), event.getSequence(), current.getGeneration());
        }

        processed.incrementAndGet();
        event.getResultFuture().complete(host);
        event.clear();
    }

    private WorkerSelector currentSelector() {
        long epoch = loadBalancer.epoch();
        if (selector == null || selector.getEpoch() != epoch) {
            selector = loadBalancer.factory().create();
            selectorRefreshes.incrementAndGet();
            log.debug("Worker {} picked up selector for epoch {}", workerId, selector.getEpoch());
        }
        return selector;
    }

    public int getWorkerId() {
        return workerId;
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long getSelectorRefreshCount() {
        return selectorRefreshes.get();
    }
}
