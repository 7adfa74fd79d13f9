package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaglevTableTest {

    private static Host host(String address, int weight) {
        return Host.builder().address(address).weight(weight).build();
    }

    private static MaglevTable build(long tableSize, Host... hosts) {
        NormalizedHostWeights weights = NormalizedHostWeights.normalize(List.of(hosts));
        return new MaglevTableBuilder(HashKeyPolicy.defaults(), tableSize)
                .createLoadBalancer(weights.weights(), weights.minWeight(), weights.maxWeight());
    }

    @Test
    @DisplayName("should fill every slot of the table")
    void shouldFillEverySlot() {
        MaglevTable table = build(7, host("a", 1), host("b", 1), host("c", 1));

        assertThat(table.getTableSize()).isEqualTo(7);
        for (long slot = 0; slot < 7; slot++) {
            assertThat(table.chooseHost(slot, 0)).isNotNull();
        }
    }

    @Test
    @DisplayName("should give each host slots in proportion to weight")
    void shouldAllocateSlotsByWeight() {
        Host light = host("10.0.0.1:80", 1);
        Host heavy = host("10.0.0.2:80", 3);
        MaglevTable table = build(MaglevTable.DEFAULT_TABLE_SIZE, light, heavy);

        Map<Host, Integer> slots = new HashMap<>();
        for (long slot = 0; slot < table.getTableSize(); slot++) {
            slots.merge(table.chooseHost(slot, 0), 1, Integer::sum);
        }

        double heavyShare = slots.get(heavy) / (double) table.getTableSize();
        assertThat(heavyShare).isBetween(0.74, 0.76);
    }

    @Test
    @DisplayName("should be deterministic and return distinct hosts for attempts")
    void shouldBeDeterministicWithDistinctAttempts() {
        Host a = host("10.0.0.1:80", 1);
        Host b = host("10.0.0.2:80", 1);
        Host c = host("10.0.0.3:80", 1);
        MaglevTable first = build(1009, a, b, c);
        MaglevTable second = build(1009, a, b, c);

        for (long hash = 0; hash < 1009; hash++) {
            assertThat(first.chooseHost(hash, 0)).isSameAs(second.chooseHost(hash, 0));
            Set<Host> seen = new HashSet<>();
            for (int attempt = 0; attempt < 3; attempt++) {
                seen.add(first.chooseHost(hash, attempt));
            }
            assertThat(seen).hasSize(3);
        }
    }

    @Test
    @DisplayName("should treat hashes as unsigned")
    void shouldTreatHashesAsUnsigned() {
        MaglevTable table = build(7, host("a", 1), host("b", 1));

        // 2^64 - 1 mod 7 == 1
        assertThat(table.chooseHost(-1L, 0)).isSameAs(table.chooseHost(1L, 0));
    }

    @Test
    @DisplayName("should reject a table size that is not prime")
    void shouldRejectNonPrimeTableSize() {
        assertThatThrownBy(() -> new MaglevTableBuilder(HashKeyPolicy.defaults(), 65536))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prime");
    }

    @Test
    @DisplayName("should return null when empty")
    void shouldReturnNullWhenEmpty() {
        MaglevTable table = new MaglevTable(List.of(), 0.0, 7, HashKeyPolicy.defaults());

        assertThat(table.chooseHost(3L, 0)).isNull();
    }
}
