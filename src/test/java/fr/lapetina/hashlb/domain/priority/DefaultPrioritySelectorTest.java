package fr.lapetina.hashlb.domain.priority;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultPrioritySelectorTest {

    private final PrioritySelector selector = new DefaultPrioritySelector();

    @Test
    @DisplayName("should map hashes onto cumulative healthy load")
    void shouldMapHashesOntoHealthyLoad() {
        PriorityLoad healthy = PriorityLoad.of(70, 30);
        PriorityLoad degraded = PriorityLoad.of(0, 0);

        assertThat(selector.choosePriority(0, healthy, degraded)).isZero();
        assertThat(selector.choosePriority(69, healthy, degraded)).isZero();
        assertThat(selector.choosePriority(70, healthy, degraded)).isEqualTo(1);
        assertThat(selector.choosePriority(99, healthy, degraded)).isEqualTo(1);
        assertThat(selector.choosePriority(170, healthy, degraded)).isEqualTo(1);
    }

    @Test
    @DisplayName("should continue into degraded load after healthy load")
    void shouldContinueIntoDegradedLoad() {
        PriorityLoad healthy = PriorityLoad.of(50, 0);
        PriorityLoad degraded = PriorityLoad.of(0, 50);

        assertThat(selector.choosePriority(10, healthy, degraded)).isZero();
        assertThat(selector.choosePriority(60, healthy, degraded)).isEqualTo(1);
    }

    @Test
    @DisplayName("should treat the hash as unsigned")
    void shouldTreatHashAsUnsigned() {
        // 2^64 - 1 mod 100 == 15
        PriorityLoad healthy = PriorityLoad.of(15, 85);

        assertThat(selector.choosePriority(-1L, healthy, PriorityLoad.of(0, 0))).isEqualTo(1);
        assertThat(selector.choosePriority(-2L, healthy, PriorityLoad.of(0, 0))).isZero();
    }

    @Test
    @DisplayName("should fall back to the first level without load")
    void shouldFallBackWithoutLoad() {
        assertThat(selector.choosePriority(42, PriorityLoad.empty(), PriorityLoad.empty())).isZero();
    }
}
