package fr.lapetina.hashlb.integration;

import fr.lapetina.hashlb.ClusterLoadBalancer;
import fr.lapetina.hashlb.disruptor.exception.BackpressureException;
import fr.lapetina.hashlb.disruptor.handlers.WorkerSelectionHandler;
import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.HostHealth;
import fr.lapetina.hashlb.domain.model.SelectionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the selection pipeline.
 * Configuration is externalized to test-config.yaml.
 */
class SelectionPipelineIntegrationTest {

    private static final List<String> PRIMARY = List.of("10.0.0.1:8080", "10.0.0.2:8080", "10.0.0.3:8080");
    private static final String FAILOVER = "10.0.1.1:8080";

    private ClusterLoadBalancer lb;

    @BeforeEach
    void setUp() {
        lb = ClusterLoadBalancer.create("test-config.yaml").start();
    }

    @AfterEach
    void tearDown() {
        if (lb != null) {
            lb.close();
        }
    }

    private Optional<Host> select(SelectionContext context) throws Exception {
        return lb.select(context).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should wire the components from configuration")
    void shouldWireFromConfiguration() {
        assertThat(lb.getPrioritySet().size()).isEqualTo(4);
        assertThat(lb.getLoadBalancer().getHashBalanceFactor()).isEqualTo(125);
        assertThat(lb.getPipeline().getHandlers()).hasSize(2);
        assertThat(lb.getPipeline().isRunning()).isTrue();
        assertThat(lb.getStats().getPrefix()).isEqualTo("test_lb");
        assertThat(lb.getStats().getRegistry().find("test_lb_refresh_total").counter()).isNotNull();
    }

    @Test
    @DisplayName("should route a hash to the same primary host every time")
    void shouldRouteConsistently() throws Exception {
        Host first = select(SelectionContext.ofHash(123456789L)).orElseThrow();

        assertThat(first.getAddress()).isIn(PRIMARY);
        for (int i = 0; i < 20; i++) {
            assertThat(select(SelectionContext.ofHash(123456789L))).contains(first);
        }
    }

    @Test
    @DisplayName("should complete many concurrent selections")
    void shouldCompleteConcurrentSelections() throws Exception {
        // Batches stay below the ring buffer size of test-config.yaml
        List<CompletableFuture<Optional<Host>>> futures = new ArrayList<>();
        for (int batch = 0; batch < 10; batch++) {
            List<CompletableFuture<Optional<Host>>> pending = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                pending.add(lb.select(SelectionContext.ofHash((batch * 50L + i) * 7919L)));
            }
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
            futures.addAll(pending);
        }

        for (CompletableFuture<Optional<Host>> future : futures) {
            assertThat(future.get()).get().extracting(Host::getAddress).isIn(PRIMARY);
        }
        long processed = lb.getPipeline().getHandlers().stream()
                .mapToLong(WorkerSelectionHandler::getProcessedCount)
                .sum();
        assertThat(processed).isGreaterThanOrEqualTo(500);
    }

    @Test
    @DisplayName("should fail over to the next priority when the primary level goes down")
    void shouldFailOverToNextPriority() throws Exception {
        for (String address : PRIMARY) {
            lb.getPrioritySet().updateHostHealth(address, HostHealth.UNHEALTHY);
        }

        for (long hash = 0; hash < 50; hash++) {
            assertThat(select(SelectionContext.ofHash(hash)))
                    .get().extracting(Host::getAddress).isEqualTo(FAILOVER);
        }
    }

    @Test
    @DisplayName("should honour an override host across priorities")
    void shouldHonourOverrideHost() throws Exception {
        assertThat(select(SelectionContext.ofOverride(FAILOVER, 1L)))
                .get().extracting(Host::getAddress).isEqualTo(FAILOVER);
    }

    @Test
    @DisplayName("should keep routing across all hosts when every host is down")
    void shouldKeepRoutingWhenAllHostsDown() throws Exception {
        for (Host host : lb.getPrioritySet().getAllHosts()) {
            lb.getPrioritySet().updateHostHealth(host.getAddress(), HostHealth.UNHEALTHY);
        }

        List<String> all = new ArrayList<>(PRIMARY);
        all.add(FAILOVER);
        for (long hash = 0; hash < 50; hash++) {
            assertThat(select(SelectionContext.ofHash(hash)))
                    .get().extracting(Host::getAddress).isIn(all);
        }
        assertThat(lb.getStats().getPanicCount()).isZero();
    }

    @Test
    @DisplayName("should reject selections once closed")
    void shouldRejectSelectionsAfterClose() {
        lb.close();

        CompletableFuture<Optional<Host>> future = lb.select(SelectionContext.ofHash(1L));

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        lb = null;
    }

    @Test
    @DisplayName("should keep runtime state of unchanged hosts across a configuration reload")
    void shouldKeepHostStateAcrossReload() throws Exception {
        Host busy = lb.getPrioritySet().getHost("10.0.0.2:8080").orElseThrow();
        for (int i = 0; i < 5; i++) {
            busy.incrementActiveRequests();
        }
        lb.getPrioritySet().updateHostHealth("10.0.0.2:8080", HostHealth.UNHEALTHY);

        String document = testConfig()
                .replace("- address: \"10.0.0.1:8080\"\n    weight: 1", "- address: \"10.0.0.1:8080\"\n    weight: 3")
                .replace("- address: \"10.0.0.3:8080\"\n", "- address: \"10.0.0.3:8080\"\n    health: degraded\n");
        lb.getConfigLoader().loadFromStream(new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8)));

        Host afterReload = lb.getPrioritySet().getHost("10.0.0.2:8080").orElseThrow();
        assertThat(afterReload).isSameAs(busy);
        assertThat(afterReload.getActiveRequests()).isEqualTo(5);
        assertThat(afterReload.getHealth()).isEqualTo(HostHealth.UNHEALTHY);
        assertThat(lb.getPrioritySet().getHost("10.0.0.1:8080")).get()
                .extracting(Host::getWeight).isEqualTo(3);
        assertThat(lb.getPrioritySet().getHost("10.0.0.3:8080")).get()
                .extracting(Host::getHealth).isEqualTo(HostHealth.DEGRADED);
        // Only one healthy primary is left, so part of the traffic spills to priority 1
        for (long hash = 0; hash < 50; hash++) {
            assertThat(select(SelectionContext.ofHash(hash)))
                    .get().extracting(Host::getAddress).isIn("10.0.0.1:8080", FAILOVER);
        }
    }

    @Test
    @DisplayName("should settle every accepted selection when closed concurrently")
    void shouldSettleSelectionsRacingClose() throws Exception {
        int submitters = 4;
        ConcurrentLinkedQueue<CompletableFuture<Optional<Host>>> futures = new ConcurrentLinkedQueue<>();
        CountDownLatch started = new CountDownLatch(submitters);
        AtomicBoolean stop = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(submitters);

        for (int s = 0; s < submitters; s++) {
            long seed = s;
            executor.submit(() -> {
                started.countDown();
                long hash = seed;
                while (!stop.get()) {
                    try {
                        futures.add(lb.select(SelectionContext.ofHash(hash)));
                    } catch (BackpressureException e) {
                        Thread.onSpinWait();
                    }
                    hash += submitters;
                }
            });
        }

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(20);
        lb.close();
        Thread.sleep(20);
        stop.set(true);
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(futures).isNotEmpty();
        for (CompletableFuture<Optional<Host>> future : futures) {
            assertThat(future.handle((host, error) -> Boolean.TRUE).get(5, TimeUnit.SECONDS)).isTrue();
        }
        lb = null;
    }

    private static String testConfig() throws IOException {
        try (InputStream in = SelectionPipelineIntegrationTest.class.getClassLoader()
                .getResourceAsStream("test-config.yaml")) {
            assertThat(in).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
