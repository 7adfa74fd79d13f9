package fr.lapetina.hashlb.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.hashlb.disruptor.exception.BackpressureException;
import fr.lapetina.hashlb.disruptor.handlers.WorkerSelectionHandler;
import fr.lapetina.hashlb.domain.balancer.ThreadAwareLoadBalancer;
import fr.lapetina.hashlb.domain.event.SelectionRequestEvent;
import fr.lapetina.hashlb.domain.event.SelectionRequestEventFactory;
import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.LoadBalancerContext;
import fr.lapetina.hashlb.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.hashlb.infrastructure.metrics.LoadBalancerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ring buffer feeding a fixed pool of selection workers.
 *
 * <p>Producers publish through a multi-producer ring buffer; every event is consumed by
 * exactly one {@link WorkerSelectionHandler}. Each handler runs on its own thread and owns
 * its own {@code WorkerSelector}, so selection needs no locking.
 *
 * <p>A full ring buffer is reported immediately as a {@link BackpressureException}.
 */
public final class SelectionPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SelectionPipeline.class);

    private final Disruptor<SelectionRequestEvent> disruptor;
    private final RingBuffer<SelectionRequestEvent> ringBuffer;
    private final List<WorkerSelectionHandler> handlers;
    private final LoadBalancerStats stats;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private SelectionPipeline(Builder builder) {
        this.stats = builder.stats;

        ThreadFactory threadFactory = new SelectionThreadFactory("lb-worker");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new SelectionRequestEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        WorkerSelectionHandler[] workers = new WorkerSelectionHandler[builder.workers];
        for (int i = 0; i < workers.length; i++) {
            workers[i] = new WorkerSelectionHandler(builder.loadBalancer, i);
        }
        this.handlers = List.of(workers);

        disruptor.handleEventsWithWorkerPool(workers);
        disruptor.setDefaultExceptionHandler(new SelectionExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("SelectionPipeline created: workers={}, ringBufferSize={}, waitStrategy={}",
                builder.workers, builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the worker threads.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("SelectionPipeline started");
        }
    }

    /**
     * Submits a selection request.
     *
     * @param context Request context carrying the hash and selection hints
     * @return future completed with the selected host, or empty when none is available
     * @throws BackpressureException if the ring buffer is full
     */
    public CompletableFuture<Optional<Host>> submit(LoadBalancerContext context) {
        if (!running.get()) {
            CompletableFuture<Optional<Host>> future = new CompletableFuture<>();
            future.completeExceptionally(new IllegalStateException("Pipeline not running"));
            return future;
        }

        CompletableFuture<Optional<Host>> resultFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            ringBuffer.get(sequence).initialize(context, resultFuture, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        if (!running.get()) {
            // close() may have drained the workers before this event was published
            resultFuture.completeExceptionally(new IllegalStateException("Pipeline not running"));
            return resultFuture;
        }
        stats.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Selection submitted: sequence={}", sequence);
        return resultFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public List<WorkerSelectionHandler> getHandlers() {
        return handlers;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Gracefully shuts down the pipeline.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down SelectionPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("SelectionPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("SelectionPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using YieldingWaitStrategy", name);
                yield new YieldingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for selection workers.
     */
    private static class SelectionThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        SelectionThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Fails the pending future instead of leaving the caller waiting.
     */
    private static class SelectionExceptionHandler implements ExceptionHandler<SelectionRequestEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, SelectionRequestEvent event) {
            log.error("Exception in selection worker: sequence={}, event={}", sequence, event, ex);
            if (event.getResultFuture() != null && !event.getResultFuture().isDone()) {
                event.getResultFuture().completeExceptionally(ex);
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during selection pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during selection pipeline shutdown", ex);
        }
    }

    /**
     * Builder for SelectionPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "yielding";
        private int workers = 4;
        private ThreadAwareLoadBalancer loadBalancer;
        private LoadBalancerStats stats;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("At least one worker is required");
            }
            this.workers = workers;
            return this;
        }

        public Builder loadBalancer(ThreadAwareLoadBalancer loadBalancer) {
            this.loadBalancer = loadBalancer;
            return this;
        }

        public Builder stats(LoadBalancerStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder fromConfig(LoadBalancerConfig config) {
            ringBufferSize(config.getWorkers().getRingBufferSize());
            workers(config.getWorkers().getCount());
            this.waitStrategy = config.getWorkers().getWaitStrategy();
            return this;
        }

        public SelectionPipeline build() {
            if (loadBalancer == null) {
                throw new IllegalStateException("ThreadAwareLoadBalancer is required");
            }
            if (stats == null) {
                stats = loadBalancer.getStats();
            }
            return new SelectionPipeline(this);
        }
    }
}
