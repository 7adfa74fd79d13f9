package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedLoadHashingTableTest {

    private Host a;
    private Host b;
    private Host c;
    private NormalizedHostWeights weights;
    private HashingTable inner;

    @BeforeEach
    void setUp() {
        // Normalized weights 0.5 / 0.3 / 0.2
        a = Host.builder().address("A").weight(5).build();
        b = Host.builder().address("B").weight(3).build();
        c = Host.builder().address("C").weight(2).build();
        weights = NormalizedHostWeights.normalize(List.of(a, b, c));

        Host[] order = {a, b, c};
        inner = (hash, attempt) -> order[attempt % order.length];
    }

    private static void load(Host host, int activeRequests) {
        for (int i = 0; i < activeRequests; i++) {
            host.incrementActiveRequests();
        }
    }

    @Nested
    @DisplayName("Pass-through")
    class PassThroughTests {

        @Test
        @DisplayName("should return the inner choice when bounding is disabled")
        void shouldPassThroughWhenDisabled() {
            load(a, 100);
            BoundedLoadHashingTable table = new BoundedLoadHashingTable(inner, weights, 100);

            for (int attempt = 0; attempt < 6; attempt++) {
                assertThat(table.chooseHost(99L, attempt)).isSameAs(inner.chooseHost(99L, attempt));
            }
        }

        @Test
        @DisplayName("should return the inner choice when nobody is overloaded")
        void shouldPassThroughWhenIdle() {
            BoundedLoadHashingTable table = new BoundedLoadHashingTable(inner, weights, 120);

            assertThat(table.chooseHost(1L, 0)).isSameAs(a);
            assertThat(table.chooseHost(1L, 1)).isSameAs(b);
        }

        @Test
        @DisplayName("should propagate an absent inner choice")
        void shouldPropagateNull() {
            BoundedLoadHashingTable table = new BoundedLoadHashingTable((hash, attempt) -> null, weights, 150);

            assertThat(table.chooseHost(1L, 0)).isNull();
        }

        @Test
        @DisplayName("should reject a factor below 100")
        void shouldRejectLowFactor() {
            assertThatThrownBy(() -> new BoundedLoadHashingTable(inner, weights, 99))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Fairness under load")
    class FairnessTests {

        @Test
        @DisplayName("should skip an overloaded host")
        void shouldSkipOverloadedHost() {
            // 10 active on A: totalSlots = ceil(11 * 1.2) = 14, A gets ceil(7.0) = 7
            load(a, 10);
            BoundedLoadHashingTable table = new BoundedLoadHashingTable(inner, weights, 120);

            assertThat(table.hostOverloadFactor(a, 0.5)).isGreaterThan(1.0);
            assertThat(table.chooseHost(5L, 0)).isIn(b, c);
        }

        @Test
        @DisplayName("should keep probing in attempt order")
        void shouldProbeInAttemptOrder() {
            load(a, 10);
            load(b, 10);
            BoundedLoadHashingTable table = new BoundedLoadHashingTable(inner, weights, 120);

            // totalSlots = ceil(21 * 1.2) = 26: A 13 slots, B 8, C 6
            assertThat(table.chooseHost(5L, 0)).isSameAs(a);

            load(a, 5);
            // totalSlots = ceil(26 * 1.2) = 32: A 16 slots, B 10, C 7
            assertThat(table.chooseHost(5L, 0)).isSameAs(a);

            load(b, 5);
            // totalSlots = ceil(31 * 1.2) = 38: A 19, B ceil(11.4) = 12, C ceil(7.6) = 8
            assertThat(table.chooseHost(5L, 0)).isSameAs(a);
            assertThat(table.chooseHost(5L, 1)).isSameAs(c);
        }

        @Test
        @DisplayName("should skip to the lightest host when the first two are overloaded")
        void shouldSkipTwoOverloadedHosts() {
            BoundedLoadHashingTable table = new BoundedLoadHashingTable(inner, weights, 120) {
                @Override
                protected double hostOverloadFactor(Host host, double weight) {
                    return host == c ? 0.5 : 2.0;
                }
            };

            assertThat(table.chooseHost(5L, 0)).isSameAs(c);
        }

        @Test
        @DisplayName("should fall back to the first candidate when every host is overloaded")
        void shouldFallBackWhenAllOverloaded() {
            BoundedLoadHashingTable table = new BoundedLoadHashingTable(inner, weights, 120) {
                @Override
                protected double hostOverloadFactor(Host host, double weight) {
                    return 2.0;
                }
            };

            assertThat(table.chooseHost(5L, 0)).isSameAs(a);
            assertThat(table.chooseHost(5L, 1)).isSameAs(b);
        }

        @Test
        @DisplayName("should always allow at least one slot per host")
        void shouldAllowAtLeastOneSlot() {
            BoundedLoadHashingTable table = new BoundedLoadHashingTable(inner, weights, 120);

            assertThat(table.hostOverloadFactor(c, 0.0)).isZero();
            c.incrementActiveRequests();
            // totalSlots = ceil(2 * 1.2) = 3, C gets max(ceil(0.6), 1) = 1
            assertThat(table.hostOverloadFactor(c, 0.2)).isEqualTo(1.0);
        }
    }
}
