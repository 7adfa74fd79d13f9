package fr.lapetina.hashlb.disruptor.handlers;

import fr.lapetina.hashlb.domain.balancer.ThreadAwareLoadBalancer;
import fr.lapetina.hashlb.domain.event.SelectionRequestEvent;
import fr.lapetina.hashlb.domain.hashing.HashKeyPolicy;
import fr.lapetina.hashlb.domain.hashing.MaglevTableBuilder;
import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.HostHealth;
import fr.lapetina.hashlb.domain.model.SelectionContext;
import fr.lapetina.hashlb.infrastructure.membership.PrioritySet;
import fr.lapetina.hashlb.infrastructure.metrics.LoadBalancerStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerSelectionHandlerTest {

    private PrioritySet prioritySet;
    private ThreadAwareLoadBalancer loadBalancer;
    private WorkerSelectionHandler handler;

    @BeforeEach
    void setUp() {
        prioritySet = new PrioritySet();
        prioritySet.replaceAll(List.of(
                Host.builder().address("a").build(),
                Host.builder().address("b").build()));
        loadBalancer = ThreadAwareLoadBalancer.builder()
                .prioritySet(prioritySet)
                .tableBuilder(new MaglevTableBuilder(HashKeyPolicy.defaults(), 101))
                .stats(new LoadBalancerStats("test"))
                .build();
        loadBalancer.initialize();
        handler = new WorkerSelectionHandler(loadBalancer, 0);
    }

    @AfterEach
    void tearDown() {
        loadBalancer.close();
    }

    private CompletableFuture<Optional<Host>> handle(SelectionContext context) {
        SelectionRequestEvent event = new SelectionRequestEvent();
        CompletableFuture<Optional<Host>> future = new CompletableFuture<>();
        event.initialize(context, future, 0);
        handler.onEvent(event);
        assertThat(event.getContext()).isNull();
        return future;
    }

    @Test
    @DisplayName("should complete the request future with the selected host")
    void shouldCompleteFuture() {
        CompletableFuture<Optional<Host>> future = handle(SelectionContext.ofHash(12L));

        assertThat(future).isCompleted();
        assertThat(future.join()).isPresent();
        assertThat(handler.getProcessedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reuse its selector while the epoch is unchanged")
    void shouldReuseSelectorWithinEpoch() {
        for (int i = 0; i < 10; i++) {
            handle(SelectionContext.ofHash(i));
        }

        assertThat(handler.getSelectorRefreshCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should recreate its selector after a membership change")
    void shouldRecreateSelectorOnNewEpoch() {
        handle(SelectionContext.ofHash(1L));

        prioritySet.updateHostHealth("a", HostHealth.UNHEALTHY);
        prioritySet.updateHostHealth("b", HostHealth.UNHEALTHY);
        prioritySet.addHost(Host.builder().address("c").build());

        assertThat(handle(SelectionContext.ofHash(1L)).join())
                .get().extracting(Host::getAddress).isEqualTo("c");
        assertThat(handler.getSelectorRefreshCount()).isEqualTo(2);
    }
}
