package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class TableProbesTest {

    private static final Host A = host("10.0.0.1:80");
    private static final Host B = host("10.0.0.2:80");
    private static final Host C = host("10.0.0.3:80");

    private static Host host(String address) {
        return Host.builder().address(address).build();
    }

    @Test
    @DisplayName("should return the n-th distinct host walking forward")
    void shouldWalkToDistinctHosts() {
        Host[] slots = {A, A, B, B, A, C, C};

        assertThat(TableProbes.nthDistinctHost(slots, 0, 0, 3)).isSameAs(A);
        assertThat(TableProbes.nthDistinctHost(slots, 0, 1, 3)).isSameAs(B);
        assertThat(TableProbes.nthDistinctHost(slots, 0, 2, 3)).isSameAs(C);
    }

    @Test
    @DisplayName("should wrap around the end of the slots")
    void shouldWrapAround() {
        Host[] slots = {A, A, B, B, A, C, C};

        assertThat(TableProbes.nthDistinctHost(slots, 5, 0, 3)).isSameAs(C);
        assertThat(TableProbes.nthDistinctHost(slots, 5, 1, 3)).isSameAs(A);
        assertThat(TableProbes.nthDistinctHost(slots, 5, 2, 3)).isSameAs(B);
    }

    @Test
    @DisplayName("should skip hosts met earlier in the walk")
    void shouldSkipHostsAlreadySeen() {
        Host[] slots = {A, B, A, B, C};

        assertThat(TableProbes.nthDistinctHost(slots, 0, 2, 3)).isSameAs(C);
    }

    @Test
    @DisplayName("should fall back to the offset slot when attempts exceed distinct hosts")
    void shouldFallBackWhenAttemptsExceedHosts() {
        Host[] slots = {A, A, B, B, A, C, C};

        assertThat(TableProbes.nthDistinctHost(slots, 0, 3, 3)).isSameAs(B);
        assertThat(TableProbes.nthDistinctHost(slots, 4, 5, 3)).isSameAs(B);
    }

    @Test
    @DisplayName("should not allocate when selecting alternate hosts")
    void shouldNotAllocateOnRetries() {
        java.lang.management.ThreadMXBean bean = ManagementFactory.getThreadMXBean();
        assumeTrue(bean instanceof com.sun.management.ThreadMXBean);
        com.sun.management.ThreadMXBean threads = (com.sun.management.ThreadMXBean) bean;
        assumeTrue(threads.isThreadAllocatedMemorySupported());
        threads.setThreadAllocatedMemoryEnabled(true);

        List<Host> hosts = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            hosts.add(host("10.0.1." + i + ":80"));
        }
        NormalizedHostWeights weights = NormalizedHostWeights.normalize(hosts);
        MaglevTable table = new MaglevTableBuilder(HashKeyPolicy.defaults(), MaglevTable.DEFAULT_TABLE_SIZE)
                .createLoadBalancer(weights.weights(), weights.minWeight(), weights.maxWeight());

        int iterations = 100_000;
        long sink = 0;
        for (int i = 0; i < iterations; i++) {
            sink += table.chooseHost(i * 0x9E3779B97F4A7C15L, 5).getWeight();
        }

        long threadId = Thread.currentThread().getId();
        long before = threads.getThreadAllocatedBytes(threadId);
        for (int i = 0; i < iterations; i++) {
            sink += table.chooseHost(i * 0x9E3779B97F4A7C15L, 5).getWeight();
        }
        long allocated = threads.getThreadAllocatedBytes(threadId) - before;

        assertThat(sink).isPositive();
        assertThat(allocated).isLessThan(64 * 1024);
    }
}
